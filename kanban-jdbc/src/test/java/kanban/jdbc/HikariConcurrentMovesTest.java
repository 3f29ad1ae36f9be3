package kanban.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import kanban.ForbiddenException;
import kanban.InvalidPositionException;
import kanban.Principal;
import kanban.engine.MutationEngine;
import kanban.jdbc.store.H2BoardStore;
import kanban.jdbc.tx.JdbcTransactionRunner;
import kanban.model.Board;
import kanban.model.BoardList;
import kanban.model.Card;
import kanban.model.Role;
import kanban.model.Visibility;
import kanban.order.Position;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrent writers on one board through a HikariCP pool. The board row lock serializes
 * them; the order of every list must stay strict and no card may be lost or duplicated.
 */
class HikariConcurrentMovesTest {
  private static final int CARDS = 20;
  private static final int THREADS = 8;
  private static final int MOVES_PER_THREAD = 25;

  private final Principal alice = Principal.of("alice");

  private HikariDataSource hikariDs;
  private MutationEngine engine;
  private Board board;
  private List<BoardList> lists;
  private List<String> cardIds;

  @BeforeEach
  void setUp() throws Exception {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(TestSchemas.h2Url("hikari"));
    config.setMaximumPoolSize(THREADS + 2);
    config.setMinimumIdle(1);
    config.setPoolName("kanban-test-pool");
    hikariDs = new HikariDataSource(config);
    TestSchemas.install(hikariDs, "h2");

    engine = MutationEngine.builder()
        .store(new H2BoardStore())
        .transactionRunner(JdbcTransactionRunner.builder().dataSource(hikariDs).build())
        .build();
    board = engine.createBoard(alice, "Busy", Visibility.PRIVATE);
    lists = List.of(
        engine.createList(alice, board.id(), "Todo", Position.atEnd()),
        engine.createList(alice, board.id(), "Doing", Position.atEnd()),
        engine.createList(alice, board.id(), "Done", Position.atEnd()));
    cardIds = new ArrayList<>();
    for (int i = 0; i < CARDS; i++) {
      cardIds.add(engine.createCard(alice, lists.get(0).id(), "Card " + i, Position.atEnd()).id());
    }
  }

  @AfterEach
  void tearDown() {
    if (hikariDs != null && !hikariDs.isClosed()) {
      hikariDs.close();
    }
  }

  @Test
  void concurrentMovesKeepEveryListStrictlyOrdered() throws Exception {
    List<Throwable> unexpected = new CopyOnWriteArrayList<>();
    AtomicInteger committed = new AtomicInteger();
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(THREADS);

    for (int t = 0; t < THREADS; t++) {
      Random random = new Random(t);
      pool.submit(() -> {
        start.await();
        for (int i = 0; i < MOVES_PER_THREAD; i++) {
          String cardId = cardIds.get(random.nextInt(CARDS));
          BoardList target = lists.get(random.nextInt(lists.size()));
          try {
            engine.moveCard(alice, cardId, target.id(), randomPosition(random));
            committed.incrementAndGet();
          } catch (InvalidPositionException expected) {
            // anchor moved away or was the card itself
          } catch (RuntimeException e) {
            unexpected.add(e);
          }
        }
        return null;
      });
    }
    start.countDown();
    pool.shutdown();
    assertTrue(pool.awaitTermination(60, TimeUnit.SECONDS), "movers did not finish");

    assertEquals(List.of(), unexpected);
    assertTrue(committed.get() > 0);

    Set<String> seen = new HashSet<>();
    for (BoardList list : lists) {
      List<Card> cards = engine.listCards(alice, list.id());
      long previous = Long.MIN_VALUE;
      for (Card card : cards) {
        assertEquals(list.id(), card.listId());
        assertTrue(card.orderKey() > previous, "keys must strictly increase in " + list.title());
        previous = card.orderKey();
        assertTrue(seen.add(card.id()), "card listed twice: " + card.id());
      }
    }
    assertEquals(new HashSet<>(cardIds), seen);
  }

  @Test
  void revocationWinsOverConcurrentMoves() throws Exception {
    Principal bob = Principal.of("bob");
    engine.setMemberRole(alice, board.id(), "bob", Role.MEMBER);
    CountDownLatch revoked = new CountDownLatch(1);
    AtomicInteger movesAfterRevoke = new AtomicInteger();
    List<Throwable> unexpected = new CopyOnWriteArrayList<>();
    ExecutorService pool = Executors.newFixedThreadPool(2);

    pool.submit(() -> {
      Random random = new Random(42);
      long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(30);
      boolean rejected = false;
      while (!rejected && System.nanoTime() < deadline) {
        boolean afterRevoke = revoked.getCount() == 0;
        try {
          engine.moveCard(bob, cardIds.get(random.nextInt(CARDS)),
              lists.get(random.nextInt(lists.size())).id(), Position.atEnd());
          if (afterRevoke) {
            movesAfterRevoke.incrementAndGet();
          }
        } catch (ForbiddenException e) {
          rejected = true;
        } catch (RuntimeException e) {
          unexpected.add(e);
          return null;
        }
      }
      if (!rejected) {
        unexpected.add(new AssertionError("bob was never rejected"));
      }
      return null;
    });
    pool.submit(() -> {
      engine.removeMember(alice, board.id(), "bob");
      revoked.countDown();
      return null;
    });
    pool.shutdown();
    assertTrue(pool.awaitTermination(60, TimeUnit.SECONDS));

    assertEquals(List.of(), unexpected);
    assertEquals(0, movesAfterRevoke.get());
  }

  private Position randomPosition(Random random) {
    switch (random.nextInt(4)) {
      case 0:
        return Position.atStart();
      case 1:
        return Position.atEnd();
      case 2:
        return Position.before(cardIds.get(random.nextInt(CARDS)));
      default:
        return Position.after(cardIds.get(random.nextInt(CARDS)));
    }
  }
}
