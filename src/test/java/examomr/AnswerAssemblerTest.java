package examomr;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static examomr.DataModels.*;
import static org.junit.jupiter.api.Assertions.*;

class AnswerAssemblerTest {

    private static PageInput pagina(String arquivo, boolean substituta) {
        return new PageInput("abc123", 1, substituta, Paths.get("1", arquivo));
    }

    private static List<DecodedAnswer> resposta(String valor) {
        return Collections.singletonList(new DecodedAnswer("abc123", "1", "i", valor, false));
    }

    @Test
    void firstPageWritesTheValue() {
        AnswerAssembler assembler = new AnswerAssembler();
        assembler.fold(pagina("abc123_1.png", false), resposta("b"));

        assertEquals("b", assembler.valueOf("abc123", "1.i"));
        assertTrue(assembler.conflicts().isEmpty());
    }

    @Test
    void differentNonReplacementDuplicatesConflictAndNeitherWins() {
        AnswerAssembler assembler = new AnswerAssembler();
        assembler.fold(pagina("abc123_1.png", false), resposta("b"));
        assembler.fold(pagina("abc123_1_2.png", false), resposta("c"));

        assertNull(assembler.valueOf("abc123", "1.i"));
        assertTrue(assembler.isConflicted("abc123", "1.i"));
        assertEquals(2, assembler.conflicts().size());
        for (PageFailure f : assembler.conflicts()) {
            assertEquals(FailureReason.DUPLICATE_NON_REPLACEMENT, f.reason);
        }
        assertEquals(Arrays.asList("abc123_1.png", "abc123_1_2.png"),
                Arrays.asList(assembler.conflicts().get(0).source, assembler.conflicts().get(1).source));
        assertFalse(assembler.table().get("abc123").containsKey("1.i"));
    }

    @Test
    void conflictReportKeepsThePageOfEachSource() {
        AnswerAssembler assembler = new AnswerAssembler();
        assembler.fold(pagina("abc123_1.png", false), resposta("b"));
        assembler.fold(new PageInput("abc123", 2, false, Paths.get("2", "abc123_2.png")), resposta("c"));

        List<PageFailure> conflitos = assembler.conflicts();
        assertEquals(2, conflitos.size());
        assertEquals("abc123_1.png", conflitos.get(0).source);
        assertEquals(1, conflitos.get(0).page);
        assertEquals("abc123_2.png", conflitos.get(1).source);
        assertEquals(2, conflitos.get(1).page);
    }

    @Test
    void identicalDuplicateIsNotAConflict() {
        AnswerAssembler assembler = new AnswerAssembler();
        assembler.fold(pagina("abc123_1.png", false), resposta("b"));
        assembler.fold(pagina("abc123_1_2.png", false), resposta("b"));

        assertEquals("b", assembler.valueOf("abc123", "1.i"));
        assertTrue(assembler.conflicts().isEmpty());
    }

    @Test
    void blankAgainstAValueIsAConflict() {
        AnswerAssembler assembler = new AnswerAssembler();
        assembler.fold(pagina("abc123_1.png", false), resposta(null));
        assembler.fold(pagina("abc123_1_2.png", false), resposta("d"));

        assertTrue(assembler.isConflicted("abc123", "1.i"));
    }

    @Test
    void replacementOverwritesUnconditionally() {
        AnswerAssembler assembler = new AnswerAssembler();
        assembler.fold(pagina("abc123_1.png", false), resposta("b"));
        assembler.fold(pagina("abc123_1_replacement.png", true), resposta("a"));

        assertEquals("a", assembler.valueOf("abc123", "1.i"));
        assertTrue(assembler.conflicts().isEmpty());
    }

    @Test
    void replacementResolvesAnEarlierConflictButTheReportStays() {
        AnswerAssembler assembler = new AnswerAssembler();
        assembler.fold(pagina("abc123_1.png", false), resposta("b"));
        assembler.fold(pagina("abc123_1_2.png", false), resposta("c"));
        assembler.fold(pagina("abc123_1_replacement.png", true), resposta("a"));

        assertEquals("a", assembler.valueOf("abc123", "1.i"));
        assertFalse(assembler.isConflicted("abc123", "1.i"));
        assertEquals(2, assembler.conflicts().size());
    }

    @Test
    void thirdDifferentDuplicateAddsOnlyItsOwnReport() {
        AnswerAssembler assembler = new AnswerAssembler();
        assembler.fold(pagina("abc123_1.png", false), resposta("b"));
        assembler.fold(pagina("abc123_1_2.png", false), resposta("c"));
        assembler.fold(pagina("abc123_1_3.png", false), resposta("b"));

        assertNull(assembler.valueOf("abc123", "1.i"));
        assertEquals(3, assembler.conflicts().size());
    }

    @Test
    void declaredColumnsAppearInOutputOrder() {
        AnswerAssembler assembler = new AnswerAssembler();
        assembler.declareColumns(Arrays.asList("10.a", "2.ii", "2.i"));
        assembler.fold(new PageInput("s1", 1, false, null),
                Collections.singletonList(new DecodedAnswer("s1", "1", "a", "c", false)));

        assertEquals(Arrays.asList("1.a", "2.i", "2.ii", "10.a"), assembler.columns());
        assertEquals(Collections.singletonList("s1"), assembler.students());
    }
}
