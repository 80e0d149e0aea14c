package com.openstay.inventory.domain.model;

import com.openstay.common.exception.InsufficientAvailabilityException;
import com.openstay.common.exception.InventoryUnderflowException;
import com.openstay.common.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InventoryCellTest {

    private static final LocalDate NIGHT = LocalDate.of(2026, 5, 10);

    @Test
    @DisplayName("available rooms are derived from total minus reserved")
    void availableRooms_isDerived() {
        InventoryCell cell = InventoryCell.provisioned(1L, "STANDARD", NIGHT, 3);

        cell.reserve(2);

        assertThat(cell.getReservedCount()).isEqualTo(2);
        assertThat(cell.availableRooms()).isEqualTo(1);
    }

    @Test
    @DisplayName("reserve beyond capacity fails and leaves the count untouched")
    void reserve_beyondCapacity_fails() {
        InventoryCell cell = InventoryCell.provisioned(1L, "STANDARD", NIGHT, 1);
        cell.reserve(1);

        assertThatThrownBy(() -> cell.reserve(1))
                .isInstanceOf(InsufficientAvailabilityException.class)
                .hasMessageContaining("STANDARD")
                .hasMessageContaining("2026-05-10");
        assertThat(cell.getReservedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("release below zero is reported as ledger underflow")
    void release_belowZero_underflows() {
        InventoryCell cell = InventoryCell.provisioned(1L, "STANDARD", NIGHT, 2);
        cell.reserve(1);

        assertThatThrownBy(() -> cell.release(2)).isInstanceOf(InventoryUnderflowException.class);
        assertThat(cell.getReservedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("capacity cannot shrink below what is already reserved")
    void resize_belowReserved_rejected() {
        InventoryCell cell = InventoryCell.provisioned(1L, "SUITE", NIGHT, 4);
        cell.reserve(3);

        assertThatThrownBy(() -> cell.resize(2)).isInstanceOf(ValidationException.class);
        cell.resize(3);
        assertThat(cell.availableRooms()).isZero();
    }
}
