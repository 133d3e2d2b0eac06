package com.openstay.reservation.domain.strategy;

import com.openstay.reservation.config.ReservationProperties;
import com.openstay.reservation.domain.model.RoomCategory;
import com.openstay.reservation.domain.model.RoomUnit;
import com.openstay.reservation.domain.model.StayInterval;
import com.openstay.reservation.domain.repository.RoomUnitRepository;
import com.openstay.reservation.domain.service.CategoryCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.inOrder;

@ExtendWith(MockitoExtension.class)
class PessimisticLockAllocationStrategyTest {

    private static final StayInterval STAY = StayInterval.of(LocalDate.of(2026, 6, 1), LocalDate.of(2026, 6, 3));
    private static final AllocationCommand COMMAND = new AllocationCommand("deluxe", STAY, "a@example.com", "Guest A");

    @Mock
    private CategoryCatalog categoryCatalog;
    @Mock
    private RoomUnitRepository roomUnitRepository;
    @Mock
    private RoomAllocator roomAllocator;

    private PessimisticLockAllocationStrategy strategy;

    @BeforeEach
    void setUp() {
        ReservationProperties properties = new ReservationProperties();
        properties.getAllocation().setLockWaitMs(250);
        strategy = new PessimisticLockAllocationStrategy(categoryCatalog, roomUnitRepository, roomAllocator, properties);
    }

    @Test
    @DisplayName("bounds lock waits with the configured timeout before locking the category's rooms")
    void allocate_setsLockTimeoutThenLocksRooms() {
        RoomCategory deluxe = RoomCategory.builder().id(7L).name("Deluxe").basePrice(new BigDecimal("100.00")).build();
        RoomUnit room = RoomUnit.builder().id(1L).roomNumber("701").category(deluxe).build();
        AllocationResult expected = new AllocationResult(null, null, deluxe, room);
        given(categoryCatalog.resolve("deluxe")).willReturn(deluxe);
        given(roomUnitRepository.findByCategoryIdForUpdate(7L)).willReturn(List.of(room));
        given(roomAllocator.allocate(deluxe, List.of(room), COMMAND)).willReturn(expected);

        assertThat(strategy.allocate(COMMAND)).isSameAs(expected);

        InOrder order = inOrder(roomUnitRepository, roomAllocator);
        order.verify(roomUnitRepository).setLocalLockTimeout("250ms");
        order.verify(roomUnitRepository).findByCategoryIdForUpdate(7L);
        order.verify(roomAllocator).allocate(deluxe, List.of(room), COMMAND);
    }

    @Test
    void strategyType() {
        assertThat(strategy.getStrategyType()).isEqualTo("PESSIMISTIC_LOCK");
    }
}
