package com.hkcraft.booking.integration;

import com.hkcraft.booking.domain.model.Actor;
import com.hkcraft.booking.domain.model.Order;
import com.hkcraft.booking.domain.model.Order.OrderStatus;
import com.hkcraft.booking.domain.model.Order.PaymentStatus;
import com.hkcraft.booking.domain.model.PaymentMethod;
import com.hkcraft.booking.domain.model.Product;
import com.hkcraft.booking.domain.model.ProductStock;
import com.hkcraft.booking.domain.model.ProductStock.StockStatus;
import com.hkcraft.booking.exception.InsufficientCapacityException;
import com.hkcraft.booking.exception.PaymentDeclinedException;
import com.hkcraft.booking.exception.ValidationFailedException;
import com.hkcraft.booking.infrastructure.cart.CartStore;
import com.hkcraft.booking.infrastructure.messaging.Notifier;
import com.hkcraft.booking.infrastructure.payment.PaymentGateway;
import com.hkcraft.booking.infrastructure.payment.PaymentResult;
import com.hkcraft.booking.repository.OrderRepository;
import com.hkcraft.booking.repository.ProductRepository;
import com.hkcraft.booking.repository.ProductStockRepository;
import com.hkcraft.booking.repository.StockReleaseRepository;
import com.hkcraft.booking.service.CheckoutCommand;
import com.hkcraft.booking.service.OrderLineRequest;
import com.hkcraft.booking.service.OrderService;
import com.hkcraft.booking.service.ResourceLedgerService;
import com.hkcraft.booking.testutil.TestDataBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Stock ledger and order flows against H2 with real transactions and row locks.
 * Not @Transactional: every service call commits on its own, as in production.
 *
 * @author Craft Booking Team
 */
@SpringBootTest
@DisplayName("Stock Ledger Integration Tests")
class StockLedgerIntegrationTest {

    @Autowired
    private ResourceLedgerService ledgerService;

    @Autowired
    private OrderService orderService;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private ProductStockRepository stockRepository;

    @Autowired
    private StockReleaseRepository releaseRepository;

    @Autowired
    private OrderRepository orderRepository;

    @MockBean
    private CartStore cartStore;

    @MockBean
    private Notifier notifier;

    @MockBean
    private PaymentGateway paymentGateway;

    private Product lantern;

    @BeforeEach
    void setUp() {
        orderRepository.deleteAll();
        releaseRepository.deleteAll();
        stockRepository.deleteAll();
        productRepository.deleteAll();

        lantern = productRepository.save(TestDataBuilder.product()
                .name("Mid-Autumn Paper Lantern")
                .build());
    }

    private List<OrderLineRequest> lines(int quantity) {
        return List.of(new OrderLineRequest(lantern.getProductId(), quantity, null));
    }

    private int quantityOf(String productId) {
        return stockRepository.findByProductId(productId).orElseThrow().getQuantity();
    }

    // ========================================
    // Order Reservation Tests
    // ========================================

    @Test
    @DisplayName("createOrder - Rejected order leaves earlier claims intact")
    void createOrder_SecondOrderTooLarge_LeavesStockUnchanged() {
        // Given
        ledgerService.register(lantern.getProductId(), 10, 0);

        // When
        Order first = orderService.createOrder("user-1", lines(2), TestDataBuilder.address());

        // Then
        assertThat(first.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(quantityOf(lantern.getProductId())).isEqualTo(8);

        assertThatThrownBy(() -> orderService.createOrder("user-2", lines(9), TestDataBuilder.address()))
                .isInstanceOf(InsufficientCapacityException.class);
        assertThat(quantityOf(lantern.getProductId())).isEqualTo(8);
        assertThat(orderRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("createOrder - One short line rolls back every line")
    void createOrder_MultiLineShortfall_RollsBackAll() {
        // Given
        Product brush = productRepository.save(TestDataBuilder.product().name("Calligraphy Brush").build());
        ledgerService.register(lantern.getProductId(), 5, 0);
        ledgerService.register(brush.getProductId(), 1, 0);

        List<OrderLineRequest> items = List.of(
                new OrderLineRequest(lantern.getProductId(), 3, null),
                new OrderLineRequest(brush.getProductId(), 2, null));

        // When / Then
        assertThatThrownBy(() -> orderService.createOrder("user-1", items, TestDataBuilder.address()))
                .isInstanceOf(InsufficientCapacityException.class);
        assertThat(quantityOf(lantern.getProductId())).isEqualTo(5);
        assertThat(quantityOf(brush.getProductId())).isEqualTo(1);
        assertThat(orderRepository.count()).isZero();
    }

    @Test
    @DisplayName("cancelOrder - Restores stock and reopens a sold out product")
    void cancelOrder_SoldOut_RestoresAndReactivates() {
        // Given
        ledgerService.register(lantern.getProductId(), 3, 0);
        Order order = orderService.createOrder("user-1", lines(3), TestDataBuilder.address());
        assertThat(stockRepository.findByProductId(lantern.getProductId()).orElseThrow().getStatus())
                .isEqualTo(StockStatus.OUT_OF_STOCK);

        // When
        Order cancelled = orderService.cancelOrder(order.getOrderId(), Actor.user("user-1"), "Changed my mind");

        // Then
        assertThat(cancelled.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        ProductStock stock = stockRepository.findByProductId(lantern.getProductId()).orElseThrow();
        assertThat(stock.getQuantity()).isEqualTo(3);
        assertThat(stock.getStatus()).isEqualTo(StockStatus.ACTIVE);
    }

    @Test
    @DisplayName("release - Repeating the order's release key restores nothing")
    void release_AfterCancel_IsIdempotent() {
        // Given
        ledgerService.register(lantern.getProductId(), 4, 0);
        Order order = orderService.createOrder("user-1", lines(2), TestDataBuilder.address());
        orderService.cancelOrder(order.getOrderId(), Actor.user("user-1"), "duplicate");

        // When
        boolean applied = ledgerService.release(lantern.getProductId(), 2,
                "order:" + order.getOrderId() + ":" + lantern.getProductId());

        // Then
        assertThat(applied).isFalse();
        assertThat(quantityOf(lantern.getProductId())).isEqualTo(4);
        assertThat(releaseRepository.findByProductId(lantern.getProductId())).hasSize(1);
    }

    // ========================================
    // Checkout Tests
    // ========================================

    @Test
    @DisplayName("checkout - Amount mismatch leaves the ledger untouched")
    void checkout_AmountMismatch_NoReservation() {
        // Given
        ledgerService.register(lantern.getProductId(), 10, 0);
        CheckoutCommand command = CheckoutCommand.builder()
                .items(lines(2))
                .shippingAddress(TestDataBuilder.address())
                .paymentAmount(new BigDecimal("100.00"))
                .paymentMethod(PaymentMethod.PAYME)
                .build();

        // When / Then
        assertThatThrownBy(() -> orderService.checkout("user-1", command))
                .isInstanceOf(ValidationFailedException.class);
        assertThat(quantityOf(lantern.getProductId())).isEqualTo(10);
        assertThat(orderRepository.count()).isZero();
        verifyNoInteractions(paymentGateway);
    }

    @Test
    @DisplayName("checkout - Approved payment confirms the order")
    void checkout_Approved_ConfirmsOrder() {
        // Given
        ledgerService.register(lantern.getProductId(), 10, 0);
        when(paymentGateway.charge(any(), any(), anyString())).thenReturn(PaymentResult.success("TXN-42"));
        CheckoutCommand command = CheckoutCommand.builder()
                .items(lines(2))
                .shippingAddress(TestDataBuilder.address())
                .paymentAmount(new BigDecimal("240.00"))
                .paymentMethod(PaymentMethod.OCTOPUS)
                .build();

        // When
        Order order = orderService.checkout("user-1", command);

        // Then
        Order stored = orderRepository.findById(order.getOrderId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(OrderStatus.CONFIRMED);
        assertThat(stored.getPaymentStatus()).isEqualTo(PaymentStatus.COMPLETED);
        assertThat(stored.getPaymentTransactionId()).isEqualTo("TXN-42");
        assertThat(quantityOf(lantern.getProductId())).isEqualTo(8);
    }

    @Test
    @DisplayName("checkout - Declined payment cancels the order and restores stock")
    void checkout_Declined_RestoresStock() {
        // Given
        ledgerService.register(lantern.getProductId(), 10, 0);
        when(paymentGateway.charge(any(), any(), anyString()))
                .thenReturn(PaymentResult.declined("INSUFFICIENT_FUNDS", "Card declined"));
        CheckoutCommand command = CheckoutCommand.builder()
                .items(lines(2))
                .shippingAddress(TestDataBuilder.address())
                .paymentAmount(new BigDecimal("240.00"))
                .paymentMethod(PaymentMethod.CREDIT_CARD)
                .build();

        // When / Then
        assertThatThrownBy(() -> orderService.checkout("user-1", command))
                .isInstanceOf(PaymentDeclinedException.class);

        assertThat(quantityOf(lantern.getProductId())).isEqualTo(10);
        List<Order> orders = orderRepository.findByUserIdOrderByCreatedAtDesc("user-1");
        assertThat(orders).hasSize(1);
        assertThat(orders.get(0).getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(orders.get(0).getPaymentStatus()).isEqualTo(PaymentStatus.FAILED);
    }

    // ========================================
    // Concurrency Tests
    // ========================================

    @Test
    @DisplayName("reserve - Concurrent claims never oversell")
    void reserve_Concurrent_NeverOversells() throws Exception {
        // Given
        ledgerService.register(lantern.getProductId(), 5, 0);
        int threads = 12;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();

        // When
        for (int i = 0; i < threads; i++) {
            results.add(pool.submit(() -> {
                start.await();
                try {
                    ledgerService.reserve(lantern.getProductId(), 1);
                    return true;
                } catch (InsufficientCapacityException e) {
                    return false;
                }
            }));
        }
        start.countDown();

        int successes = 0;
        for (Future<Boolean> result : results) {
            if (result.get(30, TimeUnit.SECONDS)) {
                successes++;
            }
        }
        pool.shutdown();

        // Then
        assertThat(successes).isEqualTo(5);
        ProductStock stock = stockRepository.findByProductId(lantern.getProductId()).orElseThrow();
        assertThat(stock.getQuantity()).isZero();
        assertThat(stock.getStatus()).isEqualTo(StockStatus.OUT_OF_STOCK);
    }
}
