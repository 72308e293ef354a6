package io.abapscan4j.core.rule;

import static org.assertj.core.api.Assertions.assertThat;

import io.abapscan4j.core.api.model.MatchResult;
import io.abapscan4j.core.api.model.RuleType;
import org.junit.jupiter.api.Test;

class RegexRuleTest {

    private final SetExtendedCheckRule setExtendedCheck = new SetExtendedCheckRule();
    private final BreakPointRule breakPoint = new BreakPointRule();

    @Test
    void emptyAndNullSourceYieldNothing() {
        assertThat(setExtendedCheck.match("").found()).isFalse();
        assertThat(breakPoint.match(null).spans()).isEmpty();
    }

    @Test
    void setExtendedCheckIgnoresCaseAndWhitespace() {
        MatchResult r = setExtendedCheck.match("REPORT z.\n  set   extended\tcheck off.\n");
        assertThat(r.found()).isTrue();
        assertThat(r.spans()).hasSize(1);
        MatchResult.Span s = r.spans().get(0);
        assertThat(s.text()).isEqualTo("set   extended\tcheck");
        assertThat(s.start()).isEqualTo(12);
        assertThat(s.end()).isEqualTo(12 + s.text().length());
    }

    @Test
    void setExtendedCheckMayWrapLines() {
        assertThat(setExtendedCheck.match("SET EXTENDED\nCHECK ON.").spans()).hasSize(1);
    }

    @Test
    void setExtendedCheckRequiresWordBoundaries() {
        assertThat(setExtendedCheck.match("RESET EXTENDED CHECKS.").found()).isFalse();
        assertThat(setExtendedCheck.match("lv_set extended check_x").found()).isFalse();
    }

    @Test
    void breakPointConsumesOneTrailingWord() {
        MatchResult r = breakPoint.match("BREAK-POINT ID zgroup.");
        assertThat(r.spans()).extracting(MatchResult.Span::text).containsExactly("BREAK-POINT ID");
    }

    @Test
    void breakPointWithoutArgument() {
        assertThat(breakPoint.match("break-point.").spans())
                .extracting(MatchResult.Span::text)
                .containsExactly("break-point");
    }

    @Test
    void breakPointEmbeddedInIdentifierIsIgnored() {
        assertThat(breakPoint.match("DATA XBREAK-POINTX TYPE i.").found()).isFalse();
        assertThat(breakPoint.match("lv_break-pointer = 1.").found()).isFalse();
    }

    @Test
    void wordBoundariesTreatUmlautsAsLetters() {
        assertThat(breakPoint.match("DATA ÄBREAK-POINT TYPE c.").found()).isFalse();
        assertThat(setExtendedCheck.match("ÜSET EXTENDED CHECK").found()).isFalse();
    }

    @Test
    void trailingWordMayContainUmlauts() {
        assertThat(breakPoint.match("BREAK-POINT lv_größe.").spans())
                .extracting(MatchResult.Span::text)
                .containsExactly("BREAK-POINT lv_größe");
    }

    @Test
    void matchesAreReportedLeftToRight() {
        MatchResult r = breakPoint.match("BREAK-POINT. BREAK-POINT lv_user.\nBREAK-POINT.");
        assertThat(r.spans()).extracting(MatchResult.Span::start).containsExactly(0, 13, 34);
    }

    @Test
    void rulesCarryTheirIssueType() {
        assertThat(setExtendedCheck.id()).isEqualTo("Rule303_SetExtendedCheck");
        assertThat(breakPoint.id()).isEqualTo("Rule304_BreakPointUsage");
        assertThat(breakPoint.type()).isEqualTo(RuleType.BREAK_POINT);
    }
}
