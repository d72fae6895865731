package com.gnovoa.livematch.lineup;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FormationShapeTest {

  @Test
  void countsLinesAndIgnoresGoalkeeper() {
    assertThat(FormationShape.label(List.of("GK", "LB", "CB", "CB", "RB", "CM", "CM", "CM", "LW", "ST", "RW")))
        .isEqualTo("4-3-3");
  }

  @Test
  void attackingMidfieldersGetTheirOwnLine() {
    assertThat(FormationShape.label(List.of("GK", "LB", "CB", "CB", "RB", "CDM", "CDM", "LAM", "CAM", "RAM", "ST")))
        .isEqualTo("4-2-3-1");
  }

  @Test
  void defensiveMidfieldersJoinTheMidfieldLine() {
    assertThat(FormationShape.label(List.of("CB", "CB", "CB", "CDM", "LM", "RM", "CM", "CF", "ST")))
        .isEqualTo("3-4-2");
  }

  @Test
  void unknownCodesCountAsForwardsAndEmptyLinesAreDropped() {
    assertThat(FormationShape.lineOf("SUB")).isEqualTo(FormationShape.Line.FORWARD);
    assertThat(FormationShape.lineOf(" cb ")).isEqualTo(FormationShape.Line.DEFENSE);
    assertThat(FormationShape.label(List.of("GK"))).isEmpty();
    assertThat(FormationShape.label(List.of("ST", "ST"))).isEqualTo("2");
  }
}
