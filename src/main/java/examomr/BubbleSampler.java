package examomr;

import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Rect;

import java.util.ArrayList;
import java.util.List;

import static examomr.DataModels.BubbleDefinition;
import static examomr.DataModels.BubbleReading;

/**
 * Lê a intensidade média de cada bolha na página alinhada. Usa o maior
 * quadrado inscrito no círculo impresso, para não pegar a tinta da borda.
 */
public class BubbleSampler {

    private final CoordinateMapper mapper;
    private final double bubbleRadius;

    public BubbleSampler(CoordinateMapper mapper, double bubbleRadius) {
        this.mapper = mapper;
        this.bubbleRadius = bubbleRadius;
    }

    public BubbleSampler(OmrConfig config) {
        this(config.coordinateMapper(), config.bubbleRadius());
    }

    /** Quadrado de amostragem da bolha, em pixels, ainda sem recorte pelos limites da imagem. */
    public Rect sampleRegion(BubbleDefinition bubble) {
        Point centro = mapper.toPixel(bubble.x, bubble.y);
        double meioLado = mapper.toPixels(bubbleRadius / Math.sqrt(2.0));
        int x0 = (int) Math.ceil(centro.x - meioLado);
        int y0 = (int) Math.ceil(centro.y - meioLado);
        int x1 = (int) Math.floor(centro.x + meioLado);
        int y1 = (int) Math.floor(centro.y + meioLado);
        return new Rect(x0, y0, Math.max(x1 - x0, 1), Math.max(y1 - y0, 1));
    }

    /**
     * @param cinza página alinhada em escala de cinza (CV_8UC1)
     * @throws LayoutMismatchException se o quadrado da bolha cai inteiro fora da imagem
     */
    public BubbleReading sample(Mat cinza, BubbleDefinition bubble) throws LayoutMismatchException {
        Rect regiao = clip(sampleRegion(bubble), cinza.cols(), cinza.rows());
        if (regiao == null) {
            throw new LayoutMismatchException("Bolha fora da página alinhada: " + bubble);
        }
        Mat sub = null;
        try {
            sub = new Mat(cinza, regiao);
            double media = Core.mean(sub).val[0];
            return new BubbleReading(bubble, media, regiao);
        } finally {
            if (sub != null) sub.release();
        }
    }

    public List<BubbleReading> sampleAll(Mat cinza, List<BubbleDefinition> bubbles) throws LayoutMismatchException {
        List<BubbleReading> leituras = new ArrayList<>(bubbles.size());
        for (BubbleDefinition b : bubbles) {
            leituras.add(sample(cinza, b));
        }
        return leituras;
    }

    static Rect clip(Rect r, int largura, int altura) {
        int x0 = Math.max(r.x, 0);
        int y0 = Math.max(r.y, 0);
        int x1 = Math.min(r.x + r.width, largura);
        int y1 = Math.min(r.y + r.height, altura);
        if (x1 <= x0 || y1 <= y0) return null;
        return new Rect(x0, y0, x1 - x0, y1 - y0);
    }
}
