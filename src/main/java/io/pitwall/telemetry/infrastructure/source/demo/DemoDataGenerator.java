package io.pitwall.telemetry.infrastructure.source.demo;

import io.pitwall.telemetry.application.segment.CyclicPositions;
import io.pitwall.telemetry.domain.telemetry.FastestLap;
import io.pitwall.telemetry.domain.telemetry.ThinFrame;
import io.pitwall.telemetry.domain.telemetry.TimingEntry;
import io.pitwall.telemetry.domain.telemetry.TimingSnapshot;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Deterministic race simulation used by the demo source.
 *
 * <p>The whole field, including driver names and car count, derives from {@code sessionId + "-" + seed},
 * so the same pair always replays the same race. Not thread-safe; the owning source serializes calls.</p>
 *
 * @since PITWALL 0.1.0
 */
public final class DemoDataGenerator {
  static final int MIN_CARS = 20;
  static final int CAR_SPREAD = 40;
  static final double BASE_LAP_MILLIS = 90_000d;
  static final long FEATURE_ROTATION_MILLIS = 5_000L;
  static final double SWAP_CHANCE = 0.02d;
  private static final double SESSION_LENGTH_SECONDS = 3_600d;
  private static final int RACE_LAPS = 50;

  private static final List<String> FIRST_NAMES = List.of(
      "Max", "Lewis", "Charles", "Carlos", "Lando", "Oscar", "George", "Fernando",
      "Sergio", "Daniel", "Pierre", "Yuki", "Valtteri", "Logan", "Alexander",
      "Kevin", "Nico", "Esteban", "Lance", "Zhou", "Marcus", "Colton", "Josef",
      "Scott", "Will", "Pato", "Felix", "Rinus", "David", "Alex");

  private static final List<String> LAST_NAMES = List.of(
      "Verstappen", "Hamilton", "Leclerc", "Sainz", "Norris", "Piastri", "Russell",
      "Alonso", "Perez", "Ricciardo", "Gasly", "Tsunoda", "Bottas", "Sargeant",
      "Albon", "Magnussen", "Hulkenberg", "Ocon", "Stroll", "Guanyu", "Ericsson",
      "Herta", "Newgarden", "Dixon", "Power", "O'Ward", "Rosenqvist", "VeeKay",
      "Malukas", "Palou");

  private static final List<String> TEAM_NAMES = List.of(
      "Red Bull Racing", "Mercedes", "Ferrari", "McLaren", "Aston Martin",
      "Alpine", "Williams", "AlphaTauri", "Alfa Romeo", "Haas",
      "Penske", "Ganassi", "Andretti", "Arrow McLaren", "Rahal Letterman");

  private static final List<String> TRACK_NAMES = List.of(
      "Silverstone Circuit", "Circuit de Spa-Francorchamps", "Monza",
      "Suzuka Circuit", "Circuit of the Americas", "Interlagos",
      "Road America", "Indianapolis Motor Speedway", "Watkins Glen");

  private final SeededRandom random;
  private final String sessionId;
  private final int carCount;
  private final String trackName;
  private final List<Driver> drivers;
  private final int[] positions;
  private final double[] lapDistPcts;
  private final double[] speeds;
  private final int[] laps;
  private int leaderLap = 1;
  private long simulatedMillis;
  private long frameSequence;

  /**
   * Builds a field.
   *
   * @param sessionId session id; part of the seed
   * @param seed seed text; {@code "default"} when {@code null} or blank
   * @param carCount fixed field size, or {@code null} to derive 20-59 cars from the seed
   */
  public DemoDataGenerator(String sessionId, String seed, Integer carCount) {
    this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
    String seedText = seed == null || seed.isBlank() ? "default" : seed;
    this.random = SeededRandom.fromText(sessionId + "-" + seedText);
    if (carCount != null && (carCount < 2 || carCount > 99)) {
      throw new IllegalArgumentException("carCount must be between 2 and 99 (was " + carCount + ")");
    }
    this.carCount = carCount != null ? carCount : MIN_CARS + random.nextInt(CAR_SPREAD);
    this.trackName = TRACK_NAMES.get(random.nextInt(TRACK_NAMES.size()));
    this.drivers = generateDrivers();
    this.positions = new int[this.carCount];
    this.lapDistPcts = new double[this.carCount];
    this.speeds = new double[this.carCount];
    this.laps = new int[this.carCount];
    for (int i = 0; i < this.carCount; i++) {
      positions[i] = i + 1;
      lapDistPcts[i] = CyclicPositions.normalize(1d - (i * 0.03d) % 1d);
      speeds[i] = 150d + random.nextDouble() * 100d;
      laps[i] = 1;
    }
  }

  private List<Driver> generateDrivers() {
    List<Driver> out = new ArrayList<>(carCount);
    Set<String> usedNumbers = new HashSet<>();
    for (int i = 0; i < carCount; i++) {
      String first = FIRST_NAMES.get(random.nextInt(FIRST_NAMES.size()));
      String last = LAST_NAMES.get(random.nextInt(LAST_NAMES.size()));
      String team = TEAM_NAMES.get(random.nextInt(TEAM_NAMES.size()));
      String number;
      do {
        number = String.valueOf(random.nextInt(99) + 1);
      } while (!usedNumbers.add(number));
      out.add(new Driver("demo-driver-" + i, first + " " + last, number, team));
    }
    return List.copyOf(out);
  }

  /**
   * Advances the simulation.
   *
   * @param deltaMillis simulated time to add; must be non-negative
   */
  public void advance(long deltaMillis) {
    if (deltaMillis < 0) {
      throw new IllegalArgumentException("deltaMillis must be non-negative");
    }
    simulatedMillis += deltaMillis;
    double distance = deltaMillis / BASE_LAP_MILLIS;
    for (int i = 0; i < carCount; i++) {
      double paceFactor = 0.95d + random.nextDouble() * 0.1d;
      double step = distance * paceFactor;
      if (i > 0 && lapDistPcts[i] - lapDistPcts[i - 1] < 0.02d) {
        step *= 0.99d + random.nextDouble() * 0.02d;
      }
      lapDistPcts[i] += step;
      if (lapDistPcts[i] >= 1d) {
        lapDistPcts[i] -= 1d;
        laps[i]++;
        if (i == 0) {
          leaderLap = laps[0];
        }
      }
      speeds[i] = 150d + Math.sin(simulatedMillis / 1000d + i) * 50d + random.nextDouble() * 50d;
    }
    if (random.nextDouble() < SWAP_CHANCE) {
      int idx = random.nextInt(carCount - 1);
      int swap = positions[idx];
      positions[idx] = positions[idx + 1];
      positions[idx + 1] = swap;
    }
  }

  /**
   * Captures the field as a timing snapshot.
   *
   * @param timestampMillis timestamp stamped on the snapshot
   * @return snapshot ordered by position
   */
  public TimingSnapshot generateTiming(long timestampMillis) {
    List<TimingEntry> entries = new ArrayList<>(carCount);
    for (int i = 0; i < carCount; i++) {
      Driver driver = drivers.get(i);
      entries.add(new TimingEntry(
          driver.driverId(),
          driver.driverName(),
          driver.carNumber(),
          driver.teamName(),
          positions[i],
          laps[i],
          lapDistPcts[i],
          88d + random.nextDouble() * 4d,
          87d + random.nextDouble() * 2d,
          i * (0.5d + random.nextDouble() * 1.5d),
          null,
          speeds[i],
          (int) Math.floor(lapDistPcts[i] * 3d) + 1,
          false,
          false));
    }
    entries.sort(Comparator.comparingInt(TimingEntry::position));
    double elapsedSeconds = simulatedMillis / 1000d;
    return new TimingSnapshot(
        sessionId,
        entries,
        "racing",
        elapsedSeconds,
        SESSION_LENGTH_SECONDS - elapsedSeconds,
        RACE_LAPS - leaderLap,
        drivers.get(0).driverId(),
        new FastestLap(drivers.get(0).driverId(), 87.5d, Math.max(1, leaderLap - 1)),
        timestampMillis);
  }

  /**
   * Captures a frame for the featured driver, which rotates every five simulated seconds.
   *
   * @param timestampMillis timestamp stamped on the frame
   * @return frame
   */
  public ThinFrame generateFrame(long timestampMillis) {
    int featured = featuredIndex();
    double speed = speeds[featured];
    double brake = random.nextDouble() < 0.2d ? random.nextDouble() * 0.5d : 0d;
    return new ThinFrame(
        sessionId,
        sessionId + "-demo-" + (++frameSequence),
        timestampMillis,
        speed,
        (int) Math.floor(1d + speed / 50d),
        (int) Math.round(5000d + speed * 40d),
        laps[featured],
        lapDistPcts[featured],
        positions[featured],
        0.3d + random.nextDouble() * 0.7d,
        brake,
        drivers.get(featured).driverId());
  }

  int featuredIndex() {
    return (int) ((simulatedMillis / FEATURE_ROTATION_MILLIS) % carCount);
  }

  /**
   * Returns the field size.
   *
   * @return car count
   */
  public int carCount() {
    return carCount;
  }

  /**
   * Returns the simulated track name.
   *
   * @return track name
   */
  public String trackName() {
    return trackName;
  }

  /**
   * Returns simulated time since the generator was built.
   *
   * @return simulated milliseconds
   */
  public long simulatedMillis() {
    return simulatedMillis;
  }

  private record Driver(String driverId, String driverName, String carNumber, String teamName) {}
}
