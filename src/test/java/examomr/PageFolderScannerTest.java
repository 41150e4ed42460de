package examomr;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static examomr.DataModels.PageInput;
import static org.junit.jupiter.api.Assertions.*;

class PageFolderScannerTest {

    private final PageFolderScanner scanner = new PageFolderScanner(true);

    private static void touch(Path dir, String nome) throws Exception {
        Files.createDirectories(dir);
        Files.write(dir.resolve(nome), new byte[]{0});
    }

    @Test
    void readsPageFoldersInDeterministicOrder(@TempDir Path raiz) throws Exception {
        touch(raiz.resolve("2"), "b22_2.png");
        touch(raiz.resolve("1"), "b22_1_replacement.jpg");
        touch(raiz.resolve("1"), "b22_1.png");
        touch(raiz.resolve("1"), "a11_1.jpeg");
        touch(raiz.resolve("1"), "b22_1_2.PNG");

        List<PageInput> paginas = scanner.scan(raiz);

        assertEquals(5, paginas.size());
        assertEquals("a11_1.jpeg", paginas.get(0).sourceName());
        assertEquals("b22_1.png", paginas.get(1).sourceName());
        assertEquals("b22_1_2.PNG", paginas.get(2).sourceName());
        assertEquals("b22_1_replacement.jpg", paginas.get(3).sourceName());
        assertTrue(paginas.get(3).replacement);
        assertFalse(paginas.get(2).replacement);
        assertEquals(2, paginas.get(4).page);
    }

    @Test
    void skipsNonPageFoldersAndStrayFiles(@TempDir Path raiz) throws Exception {
        touch(raiz.resolve("noQRcode"), "x_1.png");
        touch(raiz.resolve("1"), "notas.txt");
        touch(raiz.resolve("1"), "semnumero.png");
        touch(raiz.resolve("1"), "c33_2.png");
        touch(raiz.resolve("1"), "c33_1.png");

        List<PageInput> paginas = scanner.scan(raiz);

        assertEquals(1, paginas.size());
        assertEquals("c33", paginas.get(0).studentId);
    }

    @Test
    void studentIdMayContainUnderscores() {
        PageInput p = scanner.parse(Path.of("1", "turma_a_07_1_replacement.png"), 1);
        assertEquals("turma_a_07", p.studentId);
        assertEquals(1, p.page);
        assertTrue(p.replacement);

        PageInput q = scanner.parse(Path.of("3", "aluno-07_3.png"), 3);
        assertEquals("aluno-07", q.studentId);
        assertEquals(3, q.page);
    }

    @Test
    void missingRootIsAConfigurationError(@TempDir Path raiz) {
        assertThrows(ConfigurationException.class, () -> scanner.scan(raiz.resolve("nao_existe")));
    }
}
