package examomr.auxiliares;

import examomr.BubbleLayout;
import examomr.BubbleSampler;
import examomr.ConfigLoader;
import examomr.ConfigurationException;
import examomr.CoordinateMapper;
import examomr.OmrConfig;
import examomr.PageAligner;
import nu.pattern.OpenCV;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Rect;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import static examomr.BubbleLayout.PageLayout;
import static examomr.Constants.*;
import static examomr.DataModels.BubbleDefinition;
import static examomr.DataModels.BubbleKind;

/**
 * Plota as bolhas de uma página do gabarito numa página canônica em branco,
 * junto com a posição ideal dos quatro marcadores. Serve para conferir a
 * tabela de bolhas contra a folha impressa.
 */
public class LayoutPreview {

    static {
        OpenCV.loadLocally();
    }

    private final OmrConfig config;

    public LayoutPreview(OmrConfig config) {
        this.config = config;
    }

    public Mat render(BubbleLayout layout, int pagina) {
        PageLayout paginaLayout = layout.forPage(pagina);
        if (paginaLayout == null) {
            throw new IllegalArgumentException("Página " + pagina + " não existe no gabarito");
        }
        CoordinateMapper mapper = config.coordinateMapper();
        BubbleSampler sampler = new BubbleSampler(config);

        Mat imagem = new Mat(config.canonicalHeightPx(), config.canonicalWidthPx(), CvType.CV_8UC3, COLOR_PAGE_FILL);

        int raioMarcador = (int) Math.round(mapper.toPixels(config.markerRadius()));
        for (Point p : new PageAligner(config).canonicalMarkerPoints()) {
            Imgproc.circle(imagem, p, raioMarcador, COLOR_MARKER, 2);
        }

        for (BubbleDefinition b : paginaLayout.bubbles) {
            if (b.kind == BubbleKind.SEPARATOR) {
                Point centro = mapper.toPixel(b.x, b.y);
                Imgproc.circle(imagem, centro, 5, COLOR_SEPARATOR, 2);
                continue;
            }
            Rect r = sampler.sampleRegion(b);
            Imgproc.rectangle(imagem, new Point(r.x, r.y), new Point(r.x + r.width, r.y + r.height), COLOR_FILLED, 1);
            Imgproc.putText(imagem, b.label, new Point(r.x + r.width + 2, r.y + r.height),
                    Imgproc.FONT_HERSHEY_SIMPLEX, 0.3, COLOR_BLANK, 1);
        }
        return imagem;
    }

    public static void main(String[] args) {
        if (args.length < 2) {
            System.err.println("Uso: LayoutPreview <bolhas.csv> <pasta-saida> [página...]");
            return;
        }
        OmrConfig config = OmrConfig.fromSystemProperties();
        LayoutPreview preview = new LayoutPreview(config);
        try {
            BubbleLayout layout = ConfigLoader.loadBubbleLayout(Paths.get(args[0]));
            Path saida = Paths.get(args[1]);
            Files.createDirectories(saida);

            Iterable<Integer> paginas = layout.pages();
            if (args.length > 2) {
                List<Integer> escolhidas = new ArrayList<>();
                for (int i = 2; i < args.length; i++) escolhidas.add(Integer.parseInt(args[i]));
                paginas = escolhidas;
            }
            for (int pagina : paginas) {
                Mat imagem = preview.render(layout, pagina);
                try {
                    Path destino = saida.resolve(OUTPUT_PREVIEW_PREFIX + pagina + OUTPUT_OVERLAY_EXT);
                    Imgcodecs.imwrite(destino.toString(), imagem);
                    System.out.println("✓ Imagem salva em: " + destino);
                } finally {
                    imagem.release();
                }
            }
        } catch (ConfigurationException e) {
            System.err.println("❌ " + e.getMessage());
        } catch (IOException e) {
            System.err.println("❌ Erro ao criar pasta de saída: " + e.getMessage());
        }
    }
}
