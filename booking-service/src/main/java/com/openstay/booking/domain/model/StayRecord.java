package com.openstay.booking.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StayRecord {

    @Column(name = "checked_in_at")
    private Instant checkedInAt;

    @Column(name = "checked_in_by")
    private Long checkedInBy;

    @Enumerated(EnumType.STRING)
    @Column(name = "check_in_method", length = 20)
    private CheckInMethod checkInMethod;

    @Column(name = "checked_out_at")
    private Instant checkedOutAt;

    static StayRecord checkedIn(Instant at, Long actorId, CheckInMethod method) {
        return new StayRecord(at, actorId, method, null);
    }

    StayRecord checkedOut(Instant at) {
        return new StayRecord(checkedInAt, checkedInBy, checkInMethod, at);
    }
}
