package examomr;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static examomr.BubbleLayout.PageLayout;
import static examomr.BubbleLayout.SubquestionLayout;
import static examomr.DataModels.*;
import static org.junit.jupiter.api.Assertions.*;

class BubbleLayoutTest {

    @Test
    void classifiesChoiceAndBothDigitEncodings() {
        BubbleDefinition letra = BubbleLayout.define(1, "3", "ii", "b", 100, 200);
        BubbleDefinition comRotulo = BubbleLayout.define(1, "4-2-7", "a", "Other", 100, 200);
        BubbleDefinition soPosicao = BubbleLayout.define(1, "4-3", "a", "D", 100, 200);

        assertEquals(BubbleKind.CHOICE, letra.kind);
        assertEquals("3", letra.problem);
        assertEquals("b", letra.label);

        assertEquals(BubbleKind.DIGIT, comRotulo.kind);
        assertEquals("4", comRotulo.problem);
        assertEquals(2, comRotulo.slot);
        assertEquals("7", comRotulo.label);

        assertEquals(BubbleKind.DIGIT, soPosicao.kind);
        assertEquals(3, soPosicao.slot);
        assertEquals("D", soPosicao.label);
        assertEquals("4.a", soPosicao.column());
    }

    @Test
    void rejectsInvalidRows() {
        assertThrows(IllegalArgumentException.class, () -> BubbleLayout.define(0, "1", "a", "a", 1, 1));
        assertThrows(IllegalArgumentException.class, () -> BubbleLayout.define(1, " ", "a", "a", 1, 1));
        assertThrows(IllegalArgumentException.class, () -> BubbleLayout.define(1, "1", "a", "a", Double.NaN, 1));
        assertThrows(IllegalArgumentException.class, () -> BubbleLayout.define(1, "1-2", "a", "x", 1, 1));
    }

    @Test
    void duplicateBubbleIsRejected() {
        List<BubbleDefinition> defs = Arrays.asList(
                BubbleLayout.define(1, "1", "a", "a", 10, 10),
                BubbleLayout.define(1, "1", "a", "a", 20, 20));
        assertThrows(IllegalArgumentException.class, () -> new BubbleLayout(defs));
    }

    @Test
    void slotWithOnlyDecimalIsAPrintedSeparator() {
        List<BubbleDefinition> defs = new ArrayList<>();
        for (int d = 0; d <= 9; d++) defs.add(BubbleLayout.define(1, "2-1", "a", String.valueOf(d), 100, 400 - 15 * d));
        defs.add(BubbleLayout.define(1, "2-2", "a", "D", 120, 400));
        for (int d = 0; d <= 9; d++) defs.add(BubbleLayout.define(1, "2-3", "a", String.valueOf(d), 140, 400 - 15 * d));
        defs.add(BubbleLayout.define(1, "2", "a", "Other", 200, 400));

        PageLayout pagina = new BubbleLayout(defs).forPage(1);
        SubquestionLayout sub = pagina.subquestions.get(new SubquestionKey(1, "2", "a"));

        assertTrue(sub.isNumeric());
        assertTrue(sub.isSeparatorSlot(2));
        assertFalse(sub.isSeparatorSlot(1));
        assertEquals(1, sub.choices.size());
        assertTrue(sub.catchAllLabels.contains("Other"));
        assertEquals(21, pagina.sampledBubbles().size());
        assertEquals(4, pagina.groups.size());
    }

    @Test
    void fillableDecimalNextToDigitsStaysADigit() {
        List<BubbleDefinition> defs = new ArrayList<>();
        defs.add(BubbleLayout.define(1, "5-1", "a", "1", 100, 400));
        defs.add(BubbleLayout.define(1, "5-1", "a", "D", 100, 380));

        SubquestionLayout sub = new BubbleLayout(defs).forPage(1).subquestions.get(new SubquestionKey(1, "5", "a"));
        assertFalse(sub.isSeparatorSlot(1));
        assertEquals(BubbleKind.DIGIT, sub.slots.get(1).get(1).kind);
    }

    @Test
    void slotsCannotBeModified() {
        List<BubbleDefinition> defs = new ArrayList<>();
        defs.add(BubbleLayout.define(1, "5-1", "a", "1", 100, 400));
        defs.add(BubbleLayout.define(1, "5-2", "a", "1", 130, 400));

        SubquestionLayout sub = new BubbleLayout(defs).forPage(1).subquestions.get(new SubquestionKey(1, "5", "a"));
        assertThrows(UnsupportedOperationException.class, () -> sub.slots.remove(1));
        assertThrows(UnsupportedOperationException.class, () -> sub.slots.get(2).clear());
        assertEquals(2, sub.slots.size());
    }

    @Test
    void catchAllLabelsIncludeTheChoiceCarriedByLabelledDigitRows() {
        List<BubbleDefinition> defs = new ArrayList<>();
        defs.add(BubbleLayout.define(1, "6-1-0", "a", "Nenhum", 100, 400));
        defs.add(BubbleLayout.define(1, "6-1-1", "a", "Nenhum", 100, 380));

        SubquestionLayout sub = new BubbleLayout(defs).forPage(1).subquestions.get(new SubquestionKey(1, "6", "a"));
        assertTrue(sub.catchAllLabels.contains("Nenhum"));
        assertTrue(sub.catchAllLabels.contains("Other"));
    }

    @Test
    void columnsAreOrderedByProblemNumberThenSubquestion() {
        List<BubbleDefinition> defs = new ArrayList<>();
        defs.add(BubbleLayout.define(1, "10", "a", "a", 1, 1));
        defs.add(BubbleLayout.define(1, "2", "iv", "a", 1, 1));
        defs.add(BubbleLayout.define(1, "2", "ii", "a", 1, 1));
        defs.add(BubbleLayout.define(2, "2", "x", "a", 1, 1));
        defs.add(BubbleLayout.define(1, "1", "b", "a", 1, 1));
        defs.add(BubbleLayout.define(1, "1", "a", "a", 1, 1));

        assertEquals(Arrays.asList("1.a", "1.b", "2.ii", "2.iv", "2.x", "10.a"), new BubbleLayout(defs).columns());
    }

    @Test
    void romanValues() {
        assertEquals(Integer.valueOf(4), BubbleLayout.romanValue("iv"));
        assertEquals(Integer.valueOf(9), BubbleLayout.romanValue("IX"));
        assertEquals(Integer.valueOf(12), BubbleLayout.romanValue("xii"));
        assertNull(BubbleLayout.romanValue("c"));
        assertNull(BubbleLayout.romanValue("b"));
    }

    @Test
    void pagesWithoutBubblesHaveNoLayout() {
        BubbleLayout layout = new BubbleLayout(List.of(BubbleLayout.define(2, "1", "a", "a", 1, 1)));
        assertNull(layout.forPage(1));
        assertNotNull(layout.forPage(2));
        assertEquals(List.of(2), new ArrayList<>(layout.pages()));
    }
}
