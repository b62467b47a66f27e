package com.hkcraft.booking.exception;

/**
 * Exception thrown when a feedback rating is outside 1 to 5.
 *
 * @author Craft Booking Team
 */
public class InvalidRatingException extends RuntimeException {

    public static final int MIN_RATING = 1;
    public static final int MAX_RATING = 5;

    private final Integer rating;

    public InvalidRatingException(Integer rating) {
        super(String.format("Rating must be an integer between %d and %d, got %s", MIN_RATING, MAX_RATING, rating));
        this.rating = rating;
    }

    public Integer getRating() {
        return rating;
    }
}
