package kanban.benchmark;

import kanban.Principal;
import kanban.benchmark.BenchmarkDataSourceFactory.DatabaseSetup;
import kanban.engine.MutationEngine;
import kanban.jdbc.tx.JdbcTransactionRunner;
import kanban.model.Board;
import kanban.model.BoardList;
import kanban.model.Card;
import kanban.model.Visibility;
import kanban.order.Position;

import org.openjdk.jmh.annotations.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Measures {@link MutationEngine#moveCard} throughput (ops/sec), each move a full locked
 * transaction. Threads share one board, so they contend on its row lock.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar CardMoveBenchmark}
 * <p>PostgreSQL: {@code java -jar benchmarks/target/benchmarks.jar -p database=postgresql CardMoveBenchmark}
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class CardMoveBenchmark {
  private static final Principal OWNER = Principal.of("bench");

  private DatabaseSetup db;
  private MutationEngine engine;
  private List<String> listIds;
  private List<String> cardIds;

  @Param({"h2"})
  private String database;

  @Param({"50", "500"})
  private int cardCount;

  @Setup(Level.Trial)
  public void setup() {
    db = BenchmarkDataSourceFactory.create(database, "bench_move");
    engine = MutationEngine.builder()
        .store(db.store())
        .transactionRunner(JdbcTransactionRunner.builder().dataSource(db.dataSource()).build())
        .build();
    Board board = engine.createBoard(OWNER, "Benchmark", Visibility.PRIVATE);
    listIds = new ArrayList<>();
    for (String title : List.of("Todo", "Doing", "Done")) {
      BoardList list = engine.createList(OWNER, board.id(), title, Position.atEnd());
      listIds.add(list.id());
    }
    cardIds = new ArrayList<>(cardCount);
    for (int i = 0; i < cardCount; i++) {
      Card card = engine.createCard(OWNER, listIds.get(i % listIds.size()), "Card " + i, Position.atEnd());
      cardIds.add(card.id());
    }
  }

  @Benchmark
  public Card moveToEnd() {
    ThreadLocalRandom random = ThreadLocalRandom.current();
    return engine.moveCard(OWNER, cardIds.get(random.nextInt(cardIds.size())),
        listIds.get(random.nextInt(listIds.size())), Position.atEnd());
  }

  @Benchmark
  @Threads(4)
  public Card moveToStartContended() {
    ThreadLocalRandom random = ThreadLocalRandom.current();
    return engine.moveCard(OWNER, cardIds.get(random.nextInt(cardIds.size())),
        listIds.get(random.nextInt(listIds.size())), Position.atStart());
  }

  @TearDown(Level.Trial)
  public void tearDown() {
    db.dataSource().close();
  }
}
