package sivantoledo.statespace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered split of the periods 0..T-1 into contiguous, non-overlapping
 * regimes. Each regime is a half-open range [start, end).
 */
public class RegimePartition {

  public static class Regime {
    public final int start; // first period, inclusive
    public final int end;   // last period, exclusive

    public Regime(int start, int end) {
      if (start < 0 || end <= start) throw new ConfigurationException(String.format("invalid regime [%d, %d)", start, end));
      this.start = start;
      this.end   = end;
    }

    public int length() { return end - start; }

    public boolean contains(int t) { return t >= start && t < end; }

    @Override
    public String toString() { return "["+start+", "+end+")"; }
  }

  private final List<Regime> regimes;

  /**
   * @param regimes the regimes in time order; the first must start at 0 and
   *                each must start where the previous one ends
   * @throws ConfigurationException if the regimes are not contiguous
   */
  public RegimePartition(List<Regime> regimes) {
    if (regimes == null || regimes.isEmpty()) throw new ConfigurationException("a partition needs at least one regime");
    int expected = 0;
    for (int i=0; i<regimes.size(); i++) {
      Regime r = regimes.get(i);
      if (r.start != expected)
        throw new ConfigurationException(String.format("regime %d %s must start at period %d", i, r, expected));
      expected = r.end;
    }
    this.regimes = Collections.unmodifiableList(new ArrayList<>(regimes));
  }

  /**
   * A single regime spanning all periods.
   */
  public static RegimePartition single(int periods) {
    return new RegimePartition(Collections.singletonList(new Regime(0, periods)));
  }

  /**
   * Consecutive regimes with the given numbers of periods.
   */
  public static RegimePartition ofLengths(int... lengths) {
    List<Regime> regimes = new ArrayList<>();
    int start = 0;
    for (int length: lengths) {
      regimes.add(new Regime(start, start+length));
      start += length;
    }
    return new RegimePartition(regimes);
  }

  public int size() { return regimes.size(); }

  public Regime get(int i) { return regimes.get(i); }

  /**
   * @return the total number of periods covered, T
   */
  public int periods() { return regimes.get(regimes.size()-1).end; }

  /**
   * @throws ConfigurationException unless this partition covers exactly the given number of periods
   */
  public void checkCovers(int periods) {
    if (periods() != periods)
      throw new ConfigurationException(String.format("regimes cover %d periods, data has %d", periods(), periods));
  }

  @Override
  public String toString() { return "RegimePartition"+regimes; }
}
