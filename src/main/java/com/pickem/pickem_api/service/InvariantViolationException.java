package com.pickem.pickem_api.service;

/**
 * Input records that cannot be ranked honestly: negative counts,
 * more correct picks than picks, a percentage outside 0..100, or the same
 * user listed twice.
 */
public class InvariantViolationException extends RuntimeException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
