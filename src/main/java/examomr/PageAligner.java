package examomr;

import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static examomr.DataModels.AlignmentResult;
import static examomr.DataModels.Corner;
import static examomr.DataModels.MarkerMatch;

/**
 * Leva a página escaneada para o referencial canônico do gabarito com uma
 * homografia calculada dos quatro marcadores. Corrige translação, rotação,
 * escala e perspectiva.
 */
public class PageAligner {

    private final OmrConfig config;

    public PageAligner(OmrConfig config) {
        this.config = config;
    }

    public Size canonicalSize() {
        return new Size(config.canonicalWidthPx(), config.canonicalHeightPx());
    }

    /** Centros ideais dos marcadores na página canônica, na ordem TL, TR, BL, BR. */
    public Point[] canonicalMarkerPoints() {
        CoordinateMapper mapper = config.coordinateMapper();
        double d = config.markerDistance();
        double w = config.pageWidth(), h = config.pageHeight();
        return new Point[]{
                mapper.toPixel(d, h - d),
                mapper.toPixel(w - d, h - d),
                mapper.toPixel(d, d),
                mapper.toPixel(w - d, d)
        };
    }

    /**
     * Homografia 3x3 (CV_64F) dos marcadores encontrados para os canônicos.
     * Solução direta de 4 pontos: mesma entrada, mesma matriz.
     */
    public Mat computeTransform(List<MarkerMatch> marcadores) throws AlignmentException {
        if (marcadores.size() != 4) {
            throw new AlignmentException("São necessários 4 marcadores, recebidos " + marcadores.size());
        }
        List<MarkerMatch> ordenados = new ArrayList<>(marcadores);
        ordenados.sort(Comparator.comparing(m -> m.corner));
        for (int i = 0; i < 4; i++) {
            if (ordenados.get(i).corner != Corner.values()[i]) {
                throw new AlignmentException("Marcadores repetidos ou faltando canto: " + marcadores);
            }
        }
        MatOfPoint2f origem = new MatOfPoint2f(ordenados.get(0).position, ordenados.get(1).position,
                                               ordenados.get(2).position, ordenados.get(3).position);
        MatOfPoint2f destino = new MatOfPoint2f(canonicalMarkerPoints());
        try {
            return Imgproc.getPerspectiveTransform(origem, destino);
        } finally {
            origem.release();
            destino.release();
        }
    }

    public AlignmentResult align(Mat pagina, List<MarkerMatch> marcadores) throws AlignmentException {
        Mat transformacao = computeTransform(marcadores);
        Mat alinhada = new Mat();
        try {
            Imgproc.warpPerspective(pagina, alinhada, transformacao, canonicalSize(),
                    Imgproc.INTER_LINEAR, Core.BORDER_CONSTANT, new Scalar(255));
        } catch (RuntimeException e) {
            alinhada.release();
            throw e;
        } finally {
            transformacao.release();
        }

        double confianca = 1.0;
        for (MarkerMatch m : marcadores) confianca = Math.min(confianca, m.confidence);
        return new AlignmentResult(alinhada, confianca);
    }
}
