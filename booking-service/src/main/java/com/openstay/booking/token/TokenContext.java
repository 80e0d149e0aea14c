package com.openstay.booking.token;

/**
 * Hotel and booking a token is presented for. A token only validates inside the
 * context it was issued for.
 */
public record TokenContext(Long hotelId, Long bookingId) {
}
