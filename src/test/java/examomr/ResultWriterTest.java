package examomr;

import examomr.OmrPipeline.OmrBatchResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.opencv.core.Rect;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static examomr.DataModels.*;
import static org.junit.jupiter.api.Assertions.*;

class ResultWriterTest {

    @Test
    void escapesOnlyWhenNeeded() {
        assertEquals("simples", ResultWriter.escape("simples"));
        assertEquals("\"a,b\"", ResultWriter.escape("a,b"));
        assertEquals("\"diz \"\"oi\"\"\"", ResultWriter.escape("diz \"oi\""));
        assertEquals("\"linha\nnova\"", ResultWriter.escape("linha\nnova"));
        assertEquals("", ResultWriter.escape(null));
    }

    @Test
    void writesTheThreeOutputs(@TempDir Path dir) throws Exception {
        PageInput entrada = new PageInput("s1", 1, false, dir.resolve("s1_1.png"));
        BubbleDefinition a = BubbleLayout.define(1, "1", "a", "a", 100, 100);
        BubbleDefinition b = BubbleLayout.define(1, "1", "a", "b", 130, 100);
        GroupKey grupo = a.groupKey();
        Map<GroupKey, ThresholdDecision> limiares = new HashMap<>();
        limiares.put(grupo, new ThresholdDecision(grupo, 127.5, true));
        List<BubbleReading> leituras = Arrays.asList(
                new BubbleReading(a, 12.0, new Rect(0, 0, 5, 5)),
                new BubbleReading(b, 243.0, new Rect(10, 0, 5, 5)));
        List<DecodedAnswer> respostas = Collections.singletonList(new DecodedAnswer("s1", "1", "a", "a", false));
        PageResult pagina = new PageResult(entrada, true, 0.97, leituras, limiares, respostas, new ArrayList<>(), 10);

        AnswerAssembler assembler = new AnswerAssembler();
        assembler.declareColumns(Arrays.asList("1.a", "1.b"));
        assembler.fold(entrada, respostas);
        List<PageFailure> falhas = Collections.singletonList(
                new PageFailure("s2", 1, "s2_1.png", FailureReason.ALIGNMENT_FAILED, "marcador, canto TL"));
        OmrBatchResult resultado = new OmrBatchResult(assembler, Collections.singletonList(pagina), falhas, 1, 0, 10, 12);

        Path saida = dir.resolve("saida");
        new ResultWriter(saida).writeAll(resultado);

        assertEquals(Arrays.asList("student_id,1.a,1.b", "s1,a,"),
                Files.readAllLines(saida.resolve("consolidated_answers.csv")));
        assertEquals(Arrays.asList("student_id,page,source,reason,detail",
                        "s2,1,s2_1.png,alignment-failed,\"marcador, canto TL\""),
                Files.readAllLines(saida.resolve("failures.csv")));
        assertEquals(Arrays.asList("student_id,source,replacement,bubble,intensity,cutoff,filled",
                        "s1,s1_1.png,false,1.a_a,12.00,127.50,true",
                        "s1,s1_1.png,false,1.a_b,243.00,127.50,false"),
                Files.readAllLines(saida.resolve("page_1").resolve("1_OMR.csv")));
    }
}
