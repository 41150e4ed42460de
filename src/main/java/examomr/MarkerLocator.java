package examomr;

import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Rect;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.List;

import static examomr.Constants.DESIGN_UNITS_PER_INCH;
import static examomr.Constants.PREPROCESS_BLUR_SIZE;
import static examomr.DataModels.Corner;
import static examomr.DataModels.MarkerMatch;

/**
 * Localiza os quatro marcadores de alinhamento por correlação com o modelo,
 * procurando apenas numa região perto de cada canto da página.
 */
public class MarkerLocator {

    private final OmrConfig config;

    public MarkerLocator(OmrConfig config) {
        this.config = config;
    }

    /** Suavização 3x3 e normalização min-max para [0,255], aplicadas à página e ao modelo. */
    public static Mat preprocess(Mat cinza) {
        Mat suavizada = new Mat();
        Mat normalizada = new Mat();
        try {
            Imgproc.GaussianBlur(cinza, suavizada, new Size(PREPROCESS_BLUR_SIZE, PREPROCESS_BLUR_SIZE), 0);
            Core.normalize(suavizada, normalizada, 0, 255, Core.NORM_MINMAX);
            return normalizada;
        } finally {
            suavizada.release();
        }
    }

    /** Densidade do scan estimada pela largura da imagem em relação à largura da página. */
    public double estimateDpi(Mat pagina) {
        return pagina.cols() * DESIGN_UNITS_PER_INCH / config.pageWidth();
    }

    /** Tamanho esperado do marcador, em pixels, na densidade informada. */
    public int markerSizePx(double dpi) {
        return Math.max(3, (int) Math.round(2.0 * config.markerRadius() * dpi / DESIGN_UNITS_PER_INCH));
    }

    public Mat prepareTemplate(Mat modelo, double dpi) {
        int lado = markerSizePx(dpi);
        Mat redimensionado = new Mat();
        try {
            Imgproc.resize(modelo, redimensionado, new Size(lado, lado), 0, 0, Imgproc.INTER_AREA);
            return preprocess(redimensionado);
        } finally {
            redimensionado.release();
        }
    }

    /** Regiões de busca, na ordem TL, TR, BL, BR. */
    public Rect[] searchRegions(int largura, int altura) {
        int w = Math.max(1, (int) (largura * config.cornerSearchFraction()));
        int h = Math.max(1, (int) (altura * config.cornerSearchFraction()));
        return new Rect[]{
                new Rect(0, 0, w, h),                         // Superior Esquerdo
                new Rect(largura - w, 0, w, h),               // Superior Direito
                new Rect(0, altura - h, w, h),                // Inferior Esquerdo
                new Rect(largura - w, altura - h, w, h)       // Inferior Direito
        };
    }

    /**
     * Procura o melhor casamento em cada canto. Cantos cuja região é menor que o
     * modelo não entram na lista, então ela pode ter menos de quatro itens.
     *
     * @param pagina página bruta já pré-processada (escala de cinza)
     * @param modelo modelo do marcador como carregado do disco
     */
    public List<MarkerMatch> locate(Mat pagina, Mat modelo) {
        Mat marcador = prepareTemplate(modelo, estimateDpi(pagina));
        try {
            Rect[] regioes = searchRegions(pagina.cols(), pagina.rows());
            Corner[] cantos = Corner.values();
            List<MarkerMatch> encontrados = new ArrayList<>();

            for (int i = 0; i < regioes.length; i++) {
                Rect roi = regioes[i];
                if (roi.width < marcador.cols() || roi.height < marcador.rows()) continue;

                Mat regiao = null; Mat resultado = null;
                try {
                    regiao = new Mat(pagina, roi);
                    resultado = new Mat();
                    Imgproc.matchTemplate(regiao, marcador, resultado, Imgproc.TM_CCOEFF_NORMED);
                    Core.MinMaxLocResult mm = Core.minMaxLoc(resultado);
                    double confianca = Double.isNaN(mm.maxVal) ? 0.0 : Math.max(0.0, Math.min(1.0, mm.maxVal));
                    Point centro = new Point(roi.x + mm.maxLoc.x + marcador.cols() / 2.0,
                                             roi.y + mm.maxLoc.y + marcador.rows() / 2.0);
                    encontrados.add(new MarkerMatch(cantos[i], centro, confianca));
                } finally {
                    if (regiao != null) regiao.release();
                    if (resultado != null) resultado.release();
                }
            }
            return encontrados;
        } finally {
            marcador.release();
        }
    }

    /** Portão rígido: quatro cantos, todos com confiança mínima. */
    public void requireAll(List<MarkerMatch> marcadores) throws AlignmentException {
        if (marcadores.size() < 4) {
            throw new AlignmentException("Encontrados apenas " + marcadores.size() + " marcadores de 4");
        }
        for (MarkerMatch m : marcadores) {
            if (m.confidence < config.markerConfidenceGate()) {
                throw new AlignmentException(String.format("Marcador %s com confiança %.3f abaixo de %.2f",
                        m.corner, m.confidence, config.markerConfidenceGate()));
            }
        }
    }

    public List<MarkerMatch> locateOrFail(Mat pagina, Mat modelo) throws AlignmentException {
        List<MarkerMatch> marcadores = locate(pagina, modelo);
        requireAll(marcadores);
        return marcadores;
    }
}
