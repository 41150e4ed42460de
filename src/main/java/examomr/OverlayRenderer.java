package examomr;

import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static examomr.Constants.*;
import static examomr.DataModels.*;

/**
 * Desenha, sobre a página alinhada, os quadrados lidos e a decisão de cada
 * bolha, para conferência humana. Não interfere na tabela de respostas.
 */
public class OverlayRenderer {

    private final CoordinateMapper mapper;

    public OverlayRenderer(CoordinateMapper mapper) {
        this.mapper = mapper;
    }

    public Mat render(Mat alinhadaCinza, List<BubbleReading> leituras, Map<GroupKey, ThresholdDecision> limiares,
                      List<BubbleDefinition> separadores) {
        Mat overlay = new Mat();
        Imgproc.cvtColor(alinhadaCinza, overlay, Imgproc.COLOR_GRAY2BGR);

        for (BubbleReading r : leituras) {
            ThresholdDecision d = limiares.get(r.bubble.groupKey());
            boolean marcada = d != null && d.isFilled(r.intensity);
            Imgproc.rectangle(overlay, new Point(r.region.x, r.region.y),
                    new Point(r.region.x + r.region.width, r.region.y + r.region.height),
                    marcada ? COLOR_FILLED : COLOR_BLANK, 2);
        }
        for (BubbleDefinition s : separadores) {
            Point centro = mapper.toPixel(s.x, s.y);
            Imgproc.circle(overlay, centro, 5, COLOR_SEPARATOR, 2);
            Imgproc.circle(overlay, centro, 2, COLOR_SEPARATOR, -1);
        }
        return overlay;
    }

    public void write(Mat overlay, Path destino) throws IOException {
        Files.createDirectories(destino.getParent());
        if (!Imgcodecs.imwrite(destino.toString(), overlay)) {
            throw new IOException("Falha ao gravar overlay em " + destino);
        }
    }
}
