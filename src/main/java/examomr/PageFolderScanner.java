package examomr;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static examomr.Constants.REPLACEMENT_SUFFIX;
import static examomr.DataModels.PageInput;

/**
 * Lê a pasta organizada pelo leitor de QR: uma subpasta por número de página,
 * arquivos {@code aluno_página[_replacement|_n].ext}.
 */
public class PageFolderScanner {

    private static final Pattern FILE_NAME = Pattern.compile("^(.+?)_(\\d+)(?:_([A-Za-z0-9]+))?$");

    private final boolean quiet;

    public PageFolderScanner(boolean quiet) {
        this.quiet = quiet;
    }

    public List<PageInput> scan(Path raiz) throws ConfigurationException {
        if (!Files.isDirectory(raiz)) {
            throw new ConfigurationException("Pasta de páginas não encontrada: " + raiz);
        }
        List<Path> pastas;
        try (Stream<Path> s = Files.list(raiz)) {
            pastas = s.filter(Files::isDirectory).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new ConfigurationException("Erro ao listar " + raiz + ": " + e.getMessage(), e);
        }

        List<PageInput> paginas = new ArrayList<>();
        for (Path pasta : pastas) {
            String nome = pasta.getFileName().toString();
            if (!nome.matches("\\d+")) {
                warn("  ⚠ Pasta ignorada (não é número de página): " + pasta);
                continue;
            }
            int numero = Integer.parseInt(nome);
            List<Path> arquivos;
            try (Stream<Path> s = Files.list(pasta)) {
                arquivos = s.filter(Files::isRegularFile).filter(PageFolderScanner::isImage).sorted().collect(Collectors.toList());
            } catch (IOException e) {
                throw new ConfigurationException("Erro ao listar " + pasta + ": " + e.getMessage(), e);
            }
            for (Path arquivo : arquivos) {
                PageInput p = parse(arquivo, numero);
                if (p != null) paginas.add(p);
            }
        }
        paginas.sort(PageInput.ORDER);
        return paginas;
    }

    /** @return a página descrita pelo nome do arquivo, ou null se o nome não segue o padrão */
    PageInput parse(Path arquivo, int paginaDaPasta) {
        String nome = arquivo.getFileName().toString();
        String base = nome.substring(0, nome.lastIndexOf('.'));
        Matcher m = FILE_NAME.matcher(base);
        if (!m.matches()) {
            warn("  ⚠ Arquivo ignorado (nome fora do padrão aluno_página): " + arquivo);
            return null;
        }
        int pagina = Integer.parseInt(m.group(2));
        if (pagina != paginaDaPasta) {
            warn("  ⚠ Arquivo ignorado (página " + pagina + " na pasta " + paginaDaPasta + "): " + arquivo);
            return null;
        }
        boolean substituta = REPLACEMENT_SUFFIX.equalsIgnoreCase(m.group(3));
        return new PageInput(m.group(1), pagina, substituta, arquivo);
    }

    static boolean isImage(Path p) {
        String nome = p.getFileName().toString().toLowerCase(Locale.ROOT);
        return nome.endsWith(".png") || nome.endsWith(".jpg") || nome.endsWith(".jpeg");
    }

    private void warn(String msg) {
        if (!quiet) System.err.println(msg);
    }
}
