package examomr;

import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static examomr.DataModels.BubbleDefinition;

public class ConfigLoader {

    private static final String[] BUBBLE_COLUMNS = {"page", "question", "subquestion", "choice", "xpos", "ypos"};

    public static BubbleLayout loadBubbleLayout(Path caminho) throws ConfigurationException {
        if (!Files.isRegularFile(caminho)) {
            throw new ConfigurationException("Tabela de bolhas não encontrada: " + caminho);
        }
        try (BufferedReader br = Files.newBufferedReader(caminho, StandardCharsets.UTF_8)) {
            return loadBubbleLayout(br, caminho.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Erro ao ler tabela de bolhas " + caminho + ": " + e.getMessage(), e);
        }
    }

    /**
     * Lê o CSV (page, question, subquestion, choice, Xpos, Ypos). A ordem das
     * colunas é livre e colunas extras são ignoradas.
     */
    public static BubbleLayout loadBubbleLayout(Reader reader, String origem) throws ConfigurationException, IOException {
        BufferedReader br = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        String cabecalho = br.readLine();
        if (cabecalho == null) {
            throw new ConfigurationException("Tabela de bolhas vazia: " + origem);
        }
        Map<String, Integer> indice = headerIndex(splitCsvLine(stripBom(cabecalho)));
        for (String coluna : BUBBLE_COLUMNS) {
            if (!indice.containsKey(coluna)) {
                throw new ConfigurationException("Coluna '" + coluna + "' ausente na tabela de bolhas " + origem);
            }
        }

        List<BubbleDefinition> definicoes = new ArrayList<>();
        String line;
        int numeroLinha = 1;
        while ((line = br.readLine()) != null) {
            numeroLinha++;
            if (line.trim().isEmpty() || line.startsWith("#")) continue;
            List<String> partes = splitCsvLine(line);
            try {
                int page = parsePage(field(partes, indice, "page"));
                double x = Double.parseDouble(field(partes, indice, "xpos"));
                double y = Double.parseDouble(field(partes, indice, "ypos"));
                definicoes.add(BubbleLayout.define(page, field(partes, indice, "question"),
                        field(partes, indice, "subquestion"), field(partes, indice, "choice"), x, y));
            } catch (IllegalArgumentException e) {
                // NumberFormatException também cai aqui
                throw new ConfigurationException("Linha " + numeroLinha + " inválida em " + origem + ": " + e.getMessage(), e);
            }
        }
        if (definicoes.isEmpty()) {
            throw new ConfigurationException("Nenhuma bolha definida em " + origem);
        }
        try {
            return new BubbleLayout(definicoes);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage() + " (" + origem + ")", e);
        }
    }

    public static Mat loadMarkerTemplate(Path caminho) throws ConfigurationException {
        if (!Files.isRegularFile(caminho)) {
            throw new ConfigurationException("Imagem do marcador não encontrada: " + caminho);
        }
        Mat modelo = Imgcodecs.imread(caminho.toAbsolutePath().toString(), Imgcodecs.IMREAD_GRAYSCALE);
        if (modelo.empty()) {
            modelo.release();
            throw new ConfigurationException("Não foi possível decodificar a imagem do marcador: " + caminho);
        }
        return modelo;
    }

    private static Map<String, Integer> headerIndex(List<String> cabecalho) {
        Map<String, Integer> indice = new HashMap<>();
        for (int i = 0; i < cabecalho.size(); i++) {
            indice.putIfAbsent(cabecalho.get(i).trim().toLowerCase(Locale.ROOT), i);
        }
        return indice;
    }

    private static String field(List<String> partes, Map<String, Integer> indice, String coluna) {
        int i = indice.get(coluna);
        if (i >= partes.size()) {
            throw new IllegalArgumentException("campo '" + coluna + "' ausente");
        }
        return partes.get(i).trim();
    }

    // aceita "1.0" (tabelas exportadas como float), mas não "1.5"
    private static int parsePage(String texto) {
        double d = Double.parseDouble(texto);
        if (d != Math.rint(d) || Double.isInfinite(d) || Math.abs(d) > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("página não inteira: " + texto);
        }
        return (int) d;
    }

    private static String stripBom(String s) {
        return !s.isEmpty() && s.charAt(0) == '\uFEFF' ? s.substring(1) : s;
    }

    /** Divide uma linha CSV respeitando campos entre aspas. */
    static List<String> splitCsvLine(String line) {
        List<String> campos = new ArrayList<>();
        StringBuilder atual = new StringBuilder();
        boolean entreAspas = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (entreAspas) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        atual.append('"');
                        i++;
                    } else {
                        entreAspas = false;
                    }
                } else {
                    atual.append(c);
                }
            } else if (c == '"') {
                entreAspas = true;
            } else if (c == ',') {
                campos.add(atual.toString());
                atual.setLength(0);
            } else {
                atual.append(c);
            }
        }
        campos.add(atual.toString());
        return campos;
    }
}
