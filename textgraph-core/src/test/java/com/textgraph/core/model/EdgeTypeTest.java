package com.textgraph.core.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EdgeTypeTest {

    @ParameterizedTest
    @CsvSource({
        "ARROW, -->, SOLID, true, false",
        "LINE, ---, SOLID, false, false",
        "DOTTED_ARROW, -.->, DOTTED, true, false",
        "DOTTED_LINE, -.-, DOTTED, false, false",
        "THICK_ARROW, ==>, THICK, true, false",
        "THICK_LINE, ===, THICK, false, false",
        "BIDIR_ARROW, <-->, SOLID, true, true",
        "BIDIR_DOTTED, <-.->, DOTTED, true, true",
        "BIDIR_THICK, <==>, THICK, true, true"
    })
    void properties_matchConnector(EdgeType type, String token, LineStyle style, boolean arrow, boolean bidir) {
        assertThat(type.token()).isEqualTo(token);
        assertThat(type.lineStyle()).isEqualTo(style);
        assertThat(type.hasArrowAtEnd()).isEqualTo(arrow);
        assertThat(type.isBidirectional()).isEqualTo(bidir);
    }

    @Test
    void directionParse_acceptsTbAlias() {
        assertThat(Direction.parse("TB")).isEqualTo(Direction.TD);
        assertThat(Direction.parse(" lr ")).isEqualTo(Direction.LR);
        assertThat(Direction.RL.isHorizontal()).isTrue();
        assertThat(Direction.BT.isHorizontal()).isFalse();
    }

    @Test
    void directionParse_unknown_throwsIllegalArgumentException() {
        assertThatThrownBy(() -> Direction.parse("XY"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("XY");
    }
}
