package com.bookingchart.defrag.model;

import com.bookingchart.defrag.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MoveBatch and lifecycle values")
class MoveBatchTest {

    private static MoveBatch batch(int total, int processed, int rejected) {
        return MoveBatch.builder()
                .totalMoves(total)
                .processedMoves(processed)
                .rejectedMoves(rejected)
                .status(BatchStatus.PROCESSING)
                .build();
    }

    @Test
    @DisplayName("completion percentage is rounded to one decimal")
    void completionPercentage() {
        assertThat(batch(3, 1, 0).getCompletionPercentage()).isEqualTo(33.3);
        assertThat(batch(3, 1, 1).getCompletionPercentage()).isEqualTo(66.7);
        assertThat(batch(3, 2, 1).getCompletionPercentage()).isEqualTo(100.0);
        assertThat(batch(8, 1, 0).getCompletionPercentage()).isEqualTo(12.5);
    }

    @Test
    @DisplayName("an empty batch is 0% and complete")
    void emptyBatch() {
        MoveBatch empty = batch(0, 0, 0);

        assertThat(empty.getCompletionPercentage()).isEqualTo(0.0);
        assertThat(empty.isComplete()).isTrue();
    }

    @Test
    @DisplayName("complete only when every move is resolved")
    void isComplete() {
        assertThat(batch(3, 1, 1).isComplete()).isFalse();
        assertThat(batch(3, 1, 2).isComplete()).isTrue();
        assertThat(batch(3, 1, 2).getResolvedMoves()).isEqualTo(3);
    }

    @Test
    @DisplayName("a move is final once approved or rejected")
    void moveFinalized() {
        assertThat(DefragMove.builder().build().isFinalized()).isFalse();
        assertThat(DefragMove.builder().processed(true).build().isFinalized()).isTrue();
        assertThat(DefragMove.builder().rejected(true).build().isFinalized()).isTrue();
    }

    @Test
    @DisplayName("holiday tag copies the period onto the move")
    void holidayTag() {
        HolidayPeriod period = HolidayPeriod.of("Melbourne Cup Day", HolidayType.PUBLIC,
                LocalDate.of(2025, 11, 4), LocalDate.of(2025, 11, 4), RegionCode.VIC);
        DefragMove move = DefragMove.builder().build();

        move.applyHolidayTag(period);

        assertThat(move.isHolidayMove()).isTrue();
        assertThat(move.getHolidayPeriodName()).isEqualTo("Melbourne Cup Day");
        assertThat(move.getHolidayType()).isEqualTo(HolidayType.PUBLIC);
        assertThat(move.getHolidayImportance()).isEqualTo(HolidayImportance.HIGH);
    }

    @Test
    @DisplayName("action parsing is case-insensitive and strict")
    void moveAction() {
        assertThat(MoveAction.fromValue(" Approve ")).isEqualTo(MoveAction.APPROVE);
        assertThat(MoveAction.fromValue("reject")).isEqualTo(MoveAction.REJECT);
        assertThatThrownBy(() -> MoveAction.fromValue("apply")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> MoveAction.fromValue(null)).isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("region codes resolve case-insensitively")
    void regionCode() {
        assertThat(RegionCode.fromCode(" nsw ")).contains(RegionCode.NSW);
        assertThat(RegionCode.fromCode("XYZ")).isEmpty();
        assertThat(RegionCode.fromCode(null)).isEmpty();
    }
}
