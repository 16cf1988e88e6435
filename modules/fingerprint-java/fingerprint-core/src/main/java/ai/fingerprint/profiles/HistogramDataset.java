package ai.fingerprint.profiles;

import ai.fingerprint.bins.Bin;
import ai.fingerprint.bins.Histograms;
import ai.fingerprint.sketch.HistogramSketch;
import ai.fingerprint.types.Field;
import ai.fingerprint.types.SemanticType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Presentation table of a histogram: one {@code [bucket, share]} row per bin.
 */
public class HistogramDataset {

    public static final Field SHARE = new Field(
        "SHARE",
        "Share",
        "Share of corresponding bin in the overall population.",
        SemanticType.FLOAT,
        null
    );

    private final Field field;
    private final List<List<Object>> rows;

    public HistogramDataset(Field field, List<List<Object>> rows) {
        this.field = field;
        this.rows = Collections.unmodifiableList(rows);
    }

    public static HistogramDataset of(Field field, HistogramSketch<?> histogram) {
        return of(Function.identity(), field, histogram);
    }

    /**
     * @param keyFn converts bin keys (lower bounds or categories) to what is displayed
     */
    public static HistogramDataset of(Function<Object, Object> keyFn, Field field, HistogramSketch<?> histogram) {
        long total = histogram.totalCount();
        List<List<Object>> rows = new ArrayList<>();
        for (Bin bin : Histograms.equidistantBins(histogram)) {
            double share = total == 0 ? 0 : bin.getCount() / total;
            rows.add(Collections.unmodifiableList(Arrays.asList(keyFn.apply(bin.getKey()), share)));
        }
        return new HistogramDataset(field, rows);
    }

    public HistogramDataset withRows(List<List<Object>> rows) {
        return new HistogramDataset(field, rows);
    }

    public List<List<Object>> getRows() {
        return rows;
    }

    public List<String> getColumns() {
        return Arrays.asList(field.getName(), SHARE.getName());
    }

    public List<Field> getCols() {
        return Arrays.asList(field, SHARE);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>(3);
        result.put("rows", rows);
        result.put("columns", getColumns());
        result.put("cols", getCols());
        return result;
    }
}
