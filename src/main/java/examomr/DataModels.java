package examomr;

import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Rect;

import java.nio.file.Path;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class DataModels {

    public enum BubbleKind {
        /** Alternativa de múltipla escolha (a, b, c, Other...). */
        CHOICE,
        /** Bolha de um dígito (0-9, D ou S) dentro de uma posição numérica. */
        DIGIT,
        /** Separador impresso (D ou S) que ocupa a posição inteira e não é lido. */
        SEPARATOR
    }

    public static class BubbleDefinition {
        public final int page;
        public final String question, subquestion, choice;
        public final String problem, label;
        public final int slot;
        public final BubbleKind kind;
        public final double x, y;

        public BubbleDefinition(int page, String question, String subquestion, String choice,
                                String problem, int slot, String label, BubbleKind kind, double x, double y) {
            this.page = page; this.question = question; this.subquestion = subquestion; this.choice = choice;
            this.problem = problem; this.slot = slot; this.label = label; this.kind = kind;
            this.x = x; this.y = y;
        }

        public GroupKey groupKey() {
            return new GroupKey(page, problem, subquestion, kind == BubbleKind.CHOICE ? GroupKey.CHOICE_GROUP : slot);
        }

        public SubquestionKey subquestionKey() {
            return new SubquestionKey(page, problem, subquestion);
        }

        /** Coluna da tabela consolidada: "{problem}.{subquestion}". */
        public String column() {
            return problem + "." + subquestion;
        }

        /** Identificador legível da bolha, usado no CSV de auditoria. */
        public String bubbleId() {
            return kind == BubbleKind.CHOICE ? column() + "_" + label : column() + "_" + problem + "-" + slot + "-" + label;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof BubbleDefinition)) return false;
            BubbleDefinition that = (BubbleDefinition) o;
            return page == that.page && question.equals(that.question)
                    && subquestion.equals(that.subquestion) && choice.equals(that.choice);
        }

        @Override
        public int hashCode() {
            return Objects.hash(page, question, subquestion, choice);
        }

        @Override
        public String toString() {
            return "p" + page + " " + bubbleId() + " @(" + x + ", " + y + ")";
        }
    }

    /** Grupo de bolhas mutuamente exclusivas: as alternativas de um item, ou uma posição de dígito. */
    public static class GroupKey {
        public static final int CHOICE_GROUP = -1;

        public final int page;
        public final String problem, subquestion;
        public final int slot;

        public GroupKey(int page, String problem, String subquestion, int slot) {
            this.page = page; this.problem = problem; this.subquestion = subquestion; this.slot = slot;
        }

        public boolean isChoiceGroup() {
            return slot == CHOICE_GROUP;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof GroupKey)) return false;
            GroupKey that = (GroupKey) o;
            return page == that.page && slot == that.slot
                    && problem.equals(that.problem) && subquestion.equals(that.subquestion);
        }

        @Override
        public int hashCode() {
            return Objects.hash(page, problem, subquestion, slot);
        }

        @Override
        public String toString() {
            return problem + "." + subquestion + (isChoiceGroup() ? "" : "#" + slot);
        }
    }

    public static class SubquestionKey {
        public final int page;
        public final String problem, subquestion;

        public SubquestionKey(int page, String problem, String subquestion) {
            this.page = page; this.problem = problem; this.subquestion = subquestion;
        }

        public String column() {
            return problem + "." + subquestion;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof SubquestionKey)) return false;
            SubquestionKey that = (SubquestionKey) o;
            return page == that.page && problem.equals(that.problem) && subquestion.equals(that.subquestion);
        }

        @Override
        public int hashCode() {
            return Objects.hash(page, problem, subquestion);
        }

        @Override
        public String toString() {
            return column();
        }
    }

    /** Uma imagem de página já organizada pelo leitor de QR (fora deste módulo). */
    public static class PageInput {
        public static final Comparator<PageInput> ORDER = Comparator
                .comparingInt((PageInput p) -> p.page)
                .thenComparing(p -> p.studentId)
                .thenComparing(p -> p.replacement)
                .thenComparing(p -> p.sourceName());

        public final String studentId;
        public final int page;
        public final boolean replacement;
        public final Path source;

        public PageInput(String studentId, int page, boolean replacement, Path source) {
            this.studentId = studentId; this.page = page; this.replacement = replacement; this.source = source;
        }

        public String sourceName() {
            return source == null ? studentId + "_" + page : source.getFileName().toString();
        }

        @Override
        public String toString() {
            return sourceName() + " (aluno " + studentId + ", página " + page + (replacement ? ", substituta" : "") + ")";
        }
    }

    /** Página decodificada em escala de cinza. O dono libera a Mat. */
    public static class RawPage {
        public final PageInput input;
        public final Mat image;

        public RawPage(PageInput input, Mat image) {
            this.input = input; this.image = image;
        }

        public void release() {
            if (image != null) image.release();
        }
    }

    public enum Corner { TOP_LEFT, TOP_RIGHT, BOTTOM_LEFT, BOTTOM_RIGHT }

    public static class MarkerMatch {
        public final Corner corner;
        public final Point position;
        public final double confidence;

        public MarkerMatch(Corner corner, Point position, double confidence) {
            this.corner = corner; this.position = position; this.confidence = confidence;
        }

        @Override
        public String toString() {
            return corner + String.format(" (%.1f, %.1f) conf=%.3f", position.x, position.y, confidence);
        }
    }

    /** Página já no quadro canônico; a confiança é a do marcador mais fraco. */
    public static class AlignmentResult {
        public final Mat aligned;
        public final double confidence;

        public AlignmentResult(Mat aligned, double confidence) {
            this.aligned = aligned; this.confidence = confidence;
        }

        public void release() {
            if (aligned != null) aligned.release();
        }
    }

    public static class BubbleReading {
        public final BubbleDefinition bubble;
        public final double intensity;
        public final Rect region;

        public BubbleReading(BubbleDefinition bubble, double intensity, Rect region) {
            this.bubble = bubble; this.intensity = intensity; this.region = region;
        }
    }

    public static class ThresholdDecision {
        public final GroupKey group;
        public final double cutoff;
        public final boolean gapFound;

        public ThresholdDecision(GroupKey group, double cutoff, boolean gapFound) {
            this.group = group; this.cutoff = cutoff; this.gapFound = gapFound;
        }

        /** Tinta escurece a bolha: abaixo do corte é marcada. */
        public boolean isFilled(double intensity) {
            return intensity < cutoff;
        }
    }

    public static class DecodedAnswer {
        public final String studentId, problem, subquestion;
        public final String value;
        public final boolean ambiguous;

        public DecodedAnswer(String studentId, String problem, String subquestion, String value, boolean ambiguous) {
            this.studentId = studentId; this.problem = problem; this.subquestion = subquestion;
            this.value = value; this.ambiguous = ambiguous;
        }

        public String column() {
            return problem + "." + subquestion;
        }

        @Override
        public String toString() {
            return studentId + " " + column() + "=" + (ambiguous ? "?" : value);
        }
    }

    public enum FailureReason {
        ALIGNMENT_FAILED("alignment-failed"),
        AMBIGUOUS_BUBBLE("ambiguous-bubble"),
        DUPLICATE_NON_REPLACEMENT("duplicate-non-replacement"),
        MISSING_LAYOUT_ENTRY("missing-layout-entry"),
        IMAGE_UNREADABLE("image-unreadable"),
        PROCESSING_ERROR("processing-error");

        public final String code;

        FailureReason(String code) {
            this.code = code;
        }
    }

    public static class PageFailure {
        public static final Comparator<PageFailure> ORDER = Comparator
                .comparing((PageFailure f) -> f.studentId)
                .thenComparingInt(f -> f.page)
                .thenComparing(f -> f.reason)
                .thenComparing(f -> f.source)
                .thenComparing(f -> f.detail);

        public final String studentId;
        public final int page;
        public final String source;
        public final FailureReason reason;
        public final String detail;

        public PageFailure(String studentId, int page, String source, FailureReason reason, String detail) {
            this.studentId = studentId; this.page = page; this.source = source;
            this.reason = reason; this.detail = detail == null ? "" : detail;
        }

        public static PageFailure of(PageInput input, FailureReason reason, String detail) {
            return new PageFailure(input.studentId, input.page, input.sourceName(), reason, detail);
        }

        @Override
        public String toString() {
            return studentId + " p" + page + " [" + reason.code + "] " + detail;
        }
    }

    /** Tudo o que o processamento de uma página produziu, sucesso ou falha. */
    public static class PageResult {
        public final PageInput input;
        public final boolean decoded;
        public final double alignmentConfidence;
        public final List<BubbleReading> readings;
        public final Map<GroupKey, ThresholdDecision> thresholds;
        public final List<DecodedAnswer> answers;
        public final List<PageFailure> failures;
        public final long elapsedMs;

        public PageResult(PageInput input, boolean decoded, double alignmentConfidence, List<BubbleReading> readings,
                          Map<GroupKey, ThresholdDecision> thresholds, List<DecodedAnswer> answers,
                          List<PageFailure> failures, long elapsedMs) {
            this.input = input; this.decoded = decoded; this.alignmentConfidence = alignmentConfidence;
            this.readings = Collections.unmodifiableList(readings);
            this.thresholds = Collections.unmodifiableMap(thresholds);
            this.answers = Collections.unmodifiableList(answers);
            this.failures = Collections.unmodifiableList(failures);
            this.elapsedMs = elapsedMs;
        }

        public static PageResult failed(PageInput input, PageFailure failure, long elapsedMs) {
            return new PageResult(input, false, 0.0, Collections.emptyList(), Collections.emptyMap(),
                    Collections.emptyList(), Collections.singletonList(failure), elapsedMs);
        }

        public PageResult withElapsed(long ms) {
            return new PageResult(input, decoded, alignmentConfidence, readings, thresholds, answers, failures, ms);
        }
    }
}
