package examomr;

import examomr.OmrPipeline.OmrBatchResult;
import nu.pattern.OpenCV;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

import static examomr.Constants.*;
import static examomr.DataModels.PageFailure;

/**
 * Linha de comando:
 * {@code OmrMain <marcador.png> <bolhas.csv> <pasta-paginas> [pasta-saida]}.
 * Parâmetros de leitura vêm das propriedades {@code -Domr.*}.
 */
public class OmrMain {

    static {
        OpenCV.loadLocally();
    }

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_CONFIG = 2;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length < 3 || args.length > 4) {
            System.err.println("Uso: OmrMain <marcador> <bolhas.csv> <pasta-paginas> [pasta-saida]");
            return EXIT_USAGE;
        }
        OmrConfig config;
        try {
            config = OmrConfig.fromSystemProperties();
        } catch (IllegalArgumentException e) {
            System.err.println("❌ Configuração inválida: " + e.getMessage());
            return EXIT_USAGE;
        }

        Path marcador = Paths.get(args[0]);
        Path bolhas = Paths.get(args[1]);
        Path paginas = Paths.get(args[2]);
        Path saida = args.length == 4 ? Paths.get(args[3]) : OmrPipeline.defaultOutputDir(paginas);

        try {
            OmrBatchResult resultado = OmrPipeline.run(config, marcador, bolhas, paginas, saida);
            printFinalSummary(resultado, saida);
            return EXIT_OK;
        } catch (ConfigurationException e) {
            System.err.println("❌ " + e.getMessage());
            return EXIT_CONFIG;
        } catch (IOException e) {
            System.err.println("❌ Erro ao gravar resultados em " + saida + ": " + e.getMessage());
            return EXIT_CONFIG;
        }
    }

    static void printFinalSummary(OmrBatchResult resultado, Path saida) {
        if (resultado.processed > 0) {
            System.out.println("\n\n===== PROCESSAMENTO CONCLUÍDO =====");
            System.out.printf("  Total de Folhas Processadas: %d%n", resultado.processed);
            if (resultado.skipped > 0) {
                System.out.printf("  Folhas Não Processadas (cancelamento): %d%n", resultado.skipped);
            }
            System.out.printf("  Falhas Registradas: %d%n", resultado.failures.size());
            System.out.printf("  Tempo Total Geral: %d ms%n", resultado.wallTimeMs);
            System.out.printf("  Tempo Médio por Folha: %d ms%n", resultado.averagePageTimeMs());
            System.out.println("===================================");
            System.out.printf("  Respostas consolidadas (1 linha por aluno): %s%n", saida.resolve(OUTPUT_CONSOLIDATED));
            System.out.printf("  Relatório de falhas: %s%n", saida.resolve(OUTPUT_FAILURES));
            for (PageFailure f : resultado.failures) {
                System.out.printf("  ⚠ %s%n", f);
            }
        } else {
            System.out.println("\nProcessamento concluído. Nenhuma folha foi processada.");
        }
    }
}
