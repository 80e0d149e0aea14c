package com.openstay.booking.api.controller;

import com.openstay.booking.api.dto.ProvisionInventoryRequest;
import com.openstay.booking.domain.model.ActorRole;
import com.openstay.common.dto.BaseResponse;
import com.openstay.common.exception.ActionNotPermittedException;
import com.openstay.common.util.Constants;
import com.openstay.common.util.DateRange;
import com.openstay.inventory.api.dto.AvailabilitySnapshot;
import com.openstay.inventory.api.dto.CellAvailability;
import com.openstay.inventory.domain.service.InventoryLedger;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/**
 * Availability browsing (possibly cached) and inventory provisioning.
 */
@RestController
@RequestMapping("/api/v1/availability")
@RequiredArgsConstructor
public class AvailabilityController {

    private final InventoryLedger inventoryLedger;

    @GetMapping("/hotels/{hotelId}")
    public ResponseEntity<BaseResponse<AvailabilitySnapshot>> getAvailability(
            @PathVariable Long hotelId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate checkIn,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate checkOut,
            @RequestParam(required = false) Set<String> roomTypes) {
        AvailabilitySnapshot snapshot = inventoryLedger.query(hotelId, roomTypes, DateRange.stay(checkIn, checkOut));
        return ResponseEntity.ok(BaseResponse.success(snapshot));
    }

    @PutMapping("/hotels/{hotelId}/room-types/{roomType}")
    public ResponseEntity<BaseResponse<List<CellAvailability>>> provision(
            @RequestHeader(Constants.HEADER_ACTOR_ROLE) ActorRole role,
            @PathVariable Long hotelId,
            @PathVariable String roomType,
            @Valid @RequestBody ProvisionInventoryRequest request) {
        if (!role.isStaff()) {
            throw new ActionNotPermittedException("provision inventory", role);
        }
        List<CellAvailability> cells = inventoryLedger.provision(hotelId, roomType,
                DateRange.stay(request.from(), request.to()), request.totalRooms());
        return ResponseEntity.ok(BaseResponse.success("Inventory provisioned", cells));
    }
}
