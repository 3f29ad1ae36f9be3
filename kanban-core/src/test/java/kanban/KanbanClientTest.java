package kanban;

import kanban.engine.InMemoryBoardStore;
import kanban.engine.InMemoryTransactionRunner;
import kanban.engine.MutationEngine;
import kanban.model.Board;
import kanban.model.BoardList;
import kanban.model.Card;
import kanban.model.Visibility;
import kanban.order.Position;
import kanban.reconcile.PendingMutation;
import kanban.reconcile.SpeculativeView;
import kanban.spi.MetricsExporter;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KanbanClientTest {

  private final Principal alice = Principal.of("alice");
  private final Principal mallory = Principal.of("mallory");

  private InMemoryTransactionRunner runner;
  private RejectionCounter metrics;
  private KanbanClient client;

  @BeforeEach
  void setUp() {
    InMemoryBoardStore store = new InMemoryBoardStore();
    runner = new InMemoryTransactionRunner(store);
    metrics = new RejectionCounter();
    MutationEngine engine = MutationEngine.builder()
        .store(store)
        .transactionRunner(runner)
        .build();
    client = KanbanClient.builder()
        .engine(engine)
        .retryPolicy(attempts -> 0L)
        .maxAttempts(3)
        .metrics(metrics)
        .build();
  }

  @Test
  void confirmedCarriesCanonicalValue() {
    MutationResult<Board> result = client.createBoard(alice, "Roadmap", Visibility.PRIVATE);

    MutationResult.Confirmed<Board> confirmed = assertInstanceOf(MutationResult.Confirmed.class, result);
    assertEquals("Roadmap", confirmed.value().title());
  }

  @Test
  void failureBecomesRejectedWithKind() {
    Board board = client.createBoard(alice, "Roadmap", Visibility.PRIVATE).orElseThrow();

    MutationResult<Void> result = client.deleteBoard(mallory, board.id());

    MutationResult.Rejected<Void> rejected = assertInstanceOf(MutationResult.Rejected.class, result);
    assertEquals(ErrorKind.FORBIDDEN, rejected.error().kind());
    assertEquals(List.of(ErrorKind.FORBIDDEN), metrics.rejected);
  }

  @Test
  void voidOperationsConfirmWithNull() {
    Board board = client.createBoard(alice, "Roadmap", Visibility.PRIVATE).orElseThrow();

    MutationResult<Void> result = client.deleteBoard(alice, board.id());

    assertTrue(result.isConfirmed());
    assertNull(result.orElseThrow());
  }

  @Test
  void storeOutageIsRetried() {
    runner.failNext(new StoreUnavailableException("connection reset", null));
    int before = runner.transactions.get();

    MutationResult<Board> result = client.createBoard(alice, "Roadmap", Visibility.PRIVATE);

    assertTrue(result.isConfirmed());
    assertEquals(before + 2, runner.transactions.get());
    assertTrue(metrics.rejected.isEmpty());
  }

  @Test
  void storeOutageRejectedAfterMaxAttempts() {
    for (int i = 0; i < 3; i++) {
      runner.failNext(new StoreUnavailableException("down", null));
    }

    MutationResult<Board> result = client.createBoard(alice, "Roadmap", Visibility.PRIVATE);

    MutationResult.Rejected<Board> rejected = assertInstanceOf(MutationResult.Rejected.class, result);
    assertEquals(ErrorKind.STORE_UNAVAILABLE, rejected.error().kind());
    assertEquals(3, runner.transactions.get());
  }

  @Test
  void terminalFailuresAreNotRetried() {
    Board board = client.createBoard(alice, "Roadmap", Visibility.PRIVATE).orElseThrow();
    int before = runner.transactions.get();

    client.renameBoard(mallory, board.id(), "Mine");

    assertEquals(before + 1, runner.transactions.get());
  }

  @Test
  void interruptStopsRetrying() {
    KanbanClient sleepy = KanbanClient.builder()
        .engine(client.engine())
        .retryPolicy(attempts -> 10_000L)
        .build();
    runner.failNext(new StoreUnavailableException("down", null));

    Thread.currentThread().interrupt();
    MutationResult<Board> result = sleepy.createBoard(alice, "Roadmap", Visibility.PRIVATE);

    assertTrue(Thread.interrupted());
    assertFalse(result.isConfirmed());
  }

  @Test
  void confirmedMoveReconcilesSpeculativeView() {
    Board board = client.createBoard(alice, "Roadmap", Visibility.PRIVATE).orElseThrow();
    BoardList todo = client.createList(alice, board.id(), "Todo", Position.atEnd()).orElseThrow();
    BoardList done = client.createList(alice, board.id(), "Done", Position.atEnd()).orElseThrow();
    Card card = client.createCard(alice, todo.id(), "Ship", Position.atEnd()).orElseThrow();

    SpeculativeView<Card> view = new SpeculativeView<>();
    view.load(card.id(), card);
    PendingMutation<Card> move = view.apply(card.id(), card.withPlacement(done.id(), Long.MAX_VALUE));

    view.resolve(move, client.moveCard(alice, card.id(), done.id(), Position.atEnd()));

    Card visible = view.visible(card.id()).orElseThrow();
    assertEquals(done.id(), visible.listId());
    assertNotEquals(Long.MAX_VALUE, visible.orderKey());
  }

  @Test
  void rejectedMoveRestoresSpeculativeView() {
    Board board = client.createBoard(alice, "Roadmap", Visibility.PRIVATE).orElseThrow();
    BoardList todo = client.createList(alice, board.id(), "Todo", Position.atEnd()).orElseThrow();
    Card card = client.createCard(alice, todo.id(), "Ship", Position.atEnd()).orElseThrow();

    SpeculativeView<Card> view = new SpeculativeView<>();
    view.load(card.id(), card);
    PendingMutation<Card> move = view.apply(card.id(), card.withTitle("Hijacked"));

    view.resolve(move, client.renameCard(mallory, card.id(), "Hijacked"));

    assertEquals(card, view.visible(card.id()).orElseThrow());
  }

  @Test
  void builderValidation() {
    assertThrows(NullPointerException.class, () -> KanbanClient.builder().build());
    assertThrows(IllegalArgumentException.class,
        () -> KanbanClient.builder().engine(client.engine()).maxAttempts(0).build());
  }

  private static final class RejectionCounter implements MetricsExporter {
    final List<ErrorKind> rejected = new ArrayList<>();

    @Override
    public void incrementCommitted(String operation) {
    }

    @Override
    public void incrementRejected(ErrorKind kind) {
      rejected.add(kind);
    }

    @Override
    public void incrementRebalance() {
    }
  }
}
