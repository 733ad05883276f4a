package com.nosota.mescrow.model;

import com.nosota.mescrow.error.InvalidResolutionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Dispute resolution parsing and splitting")
class DisputeResolutionTest {

    @Test
    @DisplayName("RES-001: Named resolutions parse to their constants")
    void parseNamedResolutions() throws Exception {
        assertThat(DisputeResolution.parse("buyer_full")).isEqualTo(DisputeResolution.BUYER_FULL);
        assertThat(DisputeResolution.parse("seller_full")).isEqualTo(DisputeResolution.SELLER_FULL);
        assertThat(DisputeResolution.parse("burn")).isEqualTo(DisputeResolution.BURN);
    }

    @Test
    @DisplayName("RES-002: Split resolution keeps its percentages and string form")
    void parseSplit() throws Exception {
        DisputeResolution resolution = DisputeResolution.parse("split_70_30");

        assertThat(resolution.type()).isEqualTo(DisputeResolution.Type.SPLIT);
        assertThat(resolution.buyerPercent()).isEqualTo(70);
        assertThat(resolution.sellerPercent()).isEqualTo(30);
        assertThat(resolution.asString()).isEqualTo("split_70_30");
        assertThat(resolution.isFullRefund()).isFalse();
    }

    @Test
    @DisplayName("RES-003: Degenerate splits are accepted")
    void parseDegenerateSplits() throws Exception {
        assertThat(DisputeResolution.parse("split_100_0").apply(1000))
                .isEqualTo(new ResolutionSplit(1000, 0, 0));
        assertThat(DisputeResolution.parse("split_0_100").apply(1000))
                .isEqualTo(new ResolutionSplit(0, 1000, 0));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "refund", "BUYER_FULL", "split_60_30", "split_50", "split_a_b",
            "split_-10_110", "split_50_50_", " burn", "split_1000_0"})
    @DisplayName("RES-004: Malformed resolutions are rejected with the offending value")
    void rejectMalformed(String value) {
        assertThatThrownBy(() -> DisputeResolution.parse(value))
                .isInstanceOf(InvalidResolutionException.class)
                .satisfies(e -> assertThat(((InvalidResolutionException) e).getResolution()).isEqualTo(value));
    }

    @Test
    @DisplayName("RES-005: Null resolution is rejected")
    void rejectNull() {
        assertThatThrownBy(() -> DisputeResolution.parse(null))
                .isInstanceOf(InvalidResolutionException.class);
    }

    @Test
    @DisplayName("RES-006: 70/30 split of 1000 pays 700 and 300")
    void splitSeventyThirty() throws Exception {
        ResolutionSplit split = DisputeResolution.parse("split_70_30").apply(1000);

        assertThat(split.buyer()).isEqualTo(700);
        assertThat(split.seller()).isEqualTo(300);
        assertThat(split.destroyed()).isZero();
    }

    @Test
    @DisplayName("RES-007: Rounding remainder of a split is destroyed")
    void splitRemainderDestroyed() throws Exception {
        ResolutionSplit split = DisputeResolution.parse("split_50_50").apply(101);

        assertThat(split.buyer()).isEqualTo(50);
        assertThat(split.seller()).isEqualTo(50);
        assertThat(split.destroyed()).isEqualTo(1);
    }

    @Test
    @DisplayName("RES-008: Every resolution conserves the escrow amount")
    void conservation() throws Exception {
        String[] resolutions = {"buyer_full", "seller_full", "burn", "split_33_67", "split_1_99", "split_99_1"};
        long[] amounts = {1, 7, 101, 999, 1_000_003};

        for (String value : resolutions) {
            DisputeResolution resolution = DisputeResolution.parse(value);
            for (long amount : amounts) {
                ResolutionSplit split = resolution.apply(amount);
                assertThat(split.total()).as("%s of %d", value, amount).isEqualTo(amount);
                assertThat(split.buyer()).isNotNegative();
                assertThat(split.seller()).isNotNegative();
                assertThat(split.destroyed()).isNotNegative();
            }
        }
    }

    @Test
    @DisplayName("RES-009: Burn credits nobody")
    void burn() {
        assertThat(DisputeResolution.BURN.apply(500)).isEqualTo(new ResolutionSplit(0, 0, 500));
    }

    @Test
    @DisplayName("RES-010: split() validates the percentage sum")
    void splitFactoryValidates() throws Exception {
        assertThat(DisputeResolution.split(25, 75).asString()).isEqualTo("split_25_75");
        assertThatThrownBy(() -> DisputeResolution.split(25, 70))
                .isInstanceOf(InvalidResolutionException.class);
    }
}
