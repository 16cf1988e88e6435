package ai.fingerprint.bins;

import java.util.Objects;

/**
 * One histogram bin: its lower bound (or category) and the number of values in it.
 */
public class Bin {

    private final Object key;
    private final double count;

    public Bin(Object key, double count) {
        this.key = key;
        this.count = count;
    }

    public Object getKey() {
        return key;
    }

    public double getCount() {
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Bin bin = (Bin) o;
        return Double.compare(bin.count, count) == 0 && Objects.equals(key, bin.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, count);
    }

    @Override
    public String toString() {
        return "[" + key + " " + count + "]";
    }
}
