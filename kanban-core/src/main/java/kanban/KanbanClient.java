package kanban;

import kanban.engine.MutationEngine;
import kanban.model.Board;
import kanban.model.BoardList;
import kanban.model.Card;
import kanban.model.Comment;
import kanban.model.Label;
import kanban.model.Membership;
import kanban.model.Role;
import kanban.model.Visibility;
import kanban.order.Position;
import kanban.retry.ExponentialBackoffRetryPolicy;
import kanban.retry.RetryPolicy;
import kanban.spi.MetricsExporter;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Result-returning facade over {@link MutationEngine}.
 *
 * <p>Every operation returns a {@link MutationResult}: {@code Confirmed} with the
 * canonical state, or {@code Rejected} with the error kind and reason. No
 * {@link KanbanException} escapes. Requests that fail with
 * {@link ErrorKind#STORE_UNAVAILABLE} are resent after a backoff, up to
 * {@code maxAttempts}; all other failures are returned at once.
 *
 * <p>Programming errors such as {@code null} ids still throw.
 *
 * @see kanban.reconcile.SpeculativeView
 */
public final class KanbanClient {
  private static final Logger logger = Logger.getLogger(KanbanClient.class.getName());

  private final MutationEngine engine;
  private final RetryPolicy retryPolicy;
  private final int maxAttempts;
  private final MetricsExporter metrics;

  private KanbanClient(Builder builder) {
    this.engine = Objects.requireNonNull(builder.engine, "engine");
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(50, 2_000);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    this.maxAttempts = builder.maxAttempts;
  }

  public static Builder builder() {
    return new Builder();
  }

  public MutationEngine engine() {
    return engine;
  }

  // ── Boards ──────────────────────────────────────────────────────

  public MutationResult<Board> createBoard(Principal principal, String title, Visibility visibility) {
    return submit("createBoard", () -> engine.createBoard(principal, title, visibility));
  }

  public MutationResult<Board> renameBoard(Principal principal, String boardId, String title) {
    return submit("renameBoard", () -> engine.renameBoard(principal, boardId, title));
  }

  public MutationResult<Board> archiveBoard(Principal principal, String boardId) {
    return submit("archiveBoard", () -> engine.archiveBoard(principal, boardId));
  }

  public MutationResult<Board> restoreBoard(Principal principal, String boardId) {
    return submit("restoreBoard", () -> engine.restoreBoard(principal, boardId));
  }

  public MutationResult<Void> deleteBoard(Principal principal, String boardId) {
    return submit("deleteBoard", () -> {
      engine.deleteBoard(principal, boardId);
      return null;
    });
  }

  // ── Lists ───────────────────────────────────────────────────────

  public MutationResult<BoardList> createList(Principal principal, String boardId, String title,
      Position position) {
    return submit("createList", () -> engine.createList(principal, boardId, title, position));
  }

  public MutationResult<BoardList> renameList(Principal principal, String listId, String title) {
    return submit("renameList", () -> engine.renameList(principal, listId, title));
  }

  public MutationResult<BoardList> moveList(Principal principal, String listId, Position position) {
    return submit("moveList", () -> engine.moveList(principal, listId, position));
  }

  public MutationResult<BoardList> archiveList(Principal principal, String listId) {
    return submit("archiveList", () -> engine.archiveList(principal, listId));
  }

  public MutationResult<BoardList> restoreList(Principal principal, String listId) {
    return submit("restoreList", () -> engine.restoreList(principal, listId));
  }

  public MutationResult<Void> deleteList(Principal principal, String listId) {
    return submit("deleteList", () -> {
      engine.deleteList(principal, listId);
      return null;
    });
  }

  // ── Cards ───────────────────────────────────────────────────────

  public MutationResult<Card> createCard(Principal principal, String listId, String title,
      Position position) {
    return submit("createCard", () -> engine.createCard(principal, listId, title, position));
  }

  public MutationResult<Card> moveCard(Principal principal, String cardId, String targetListId,
      Position position) {
    return submit("moveCard", () -> engine.moveCard(principal, cardId, targetListId, position));
  }

  public MutationResult<Card> renameCard(Principal principal, String cardId, String title) {
    return submit("renameCard", () -> engine.renameCard(principal, cardId, title));
  }

  public MutationResult<Card> updateCardDetails(Principal principal, String cardId, String description,
      LocalDate dueDate) {
    return submit("updateCardDetails",
        () -> engine.updateCardDetails(principal, cardId, description, dueDate));
  }

  public MutationResult<Card> archiveCard(Principal principal, String cardId) {
    return submit("archiveCard", () -> engine.archiveCard(principal, cardId));
  }

  public MutationResult<Card> restoreCard(Principal principal, String cardId) {
    return submit("restoreCard", () -> engine.restoreCard(principal, cardId));
  }

  public MutationResult<Void> deleteCard(Principal principal, String cardId) {
    return submit("deleteCard", () -> {
      engine.deleteCard(principal, cardId);
      return null;
    });
  }

  // ── Membership ──────────────────────────────────────────────────

  public MutationResult<Membership> setMemberRole(Principal principal, String boardId, String userId,
      Role role) {
    return submit("setMemberRole", () -> engine.setMemberRole(principal, boardId, userId, role));
  }

  public MutationResult<Void> removeMember(Principal principal, String boardId, String userId) {
    return submit("removeMember", () -> {
      engine.removeMember(principal, boardId, userId);
      return null;
    });
  }

  public MutationResult<Board> transferOwnership(Principal principal, String boardId, String newOwnerId) {
    return submit("transferOwnership", () -> engine.transferOwnership(principal, boardId, newOwnerId));
  }

  // ── Labels and comments ─────────────────────────────────────────

  public MutationResult<Label> createLabel(Principal principal, String boardId, String name, String color) {
    return submit("createLabel", () -> engine.createLabel(principal, boardId, name, color));
  }

  public MutationResult<Void> deleteLabel(Principal principal, String labelId) {
    return submit("deleteLabel", () -> {
      engine.deleteLabel(principal, labelId);
      return null;
    });
  }

  public MutationResult<Card> attachLabel(Principal principal, String cardId, String labelId) {
    return submit("attachLabel", () -> engine.attachLabel(principal, cardId, labelId));
  }

  public MutationResult<Card> detachLabel(Principal principal, String cardId, String labelId) {
    return submit("detachLabel", () -> engine.detachLabel(principal, cardId, labelId));
  }

  public MutationResult<Comment> addComment(Principal principal, String cardId, String body) {
    return submit("addComment", () -> engine.addComment(principal, cardId, body));
  }

  // ── Reads ───────────────────────────────────────────────────────

  public MutationResult<Board> getBoard(Principal principal, String boardId) {
    return submit("getBoard", () -> engine.getBoard(principal, boardId));
  }

  public MutationResult<List<BoardList>> listLists(Principal principal, String boardId) {
    return submit("listLists", () -> engine.listLists(principal, boardId));
  }

  public MutationResult<List<Card>> listCards(Principal principal, String listId) {
    return submit("listCards", () -> engine.listCards(principal, listId));
  }

  public MutationResult<List<Comment>> listComments(Principal principal, String cardId) {
    return submit("listComments", () -> engine.listComments(principal, cardId));
  }

  public MutationResult<List<Membership>> listMembers(Principal principal, String boardId) {
    return submit("listMembers", () -> engine.listMembers(principal, boardId));
  }

  public MutationResult<List<Label>> listLabels(Principal principal, String boardId) {
    return submit("listLabels", () -> engine.listLabels(principal, boardId));
  }

  private <T> MutationResult<T> submit(String operation, Supplier<T> call) {
    int attempt = 0;
    while (true) {
      attempt++;
      try {
        return MutationResult.confirmed(call.get());
      } catch (KanbanException e) {
        if (e.kind().isRetryable() && attempt < maxAttempts) {
          long delayMs = retryPolicy.computeDelayMs(attempt);
          logger.log(Level.WARNING, "{0} failed with {1} (attempt {2}/{3}), retrying in {4} ms",
              new Object[] {operation, e.kind(), attempt, maxAttempts, delayMs});
          if (sleep(delayMs)) {
            continue;
          }
        }
        return reject(operation, e);
      }
    }
  }

  private <T> MutationResult<T> reject(String operation, KanbanException e) {
    MutationError error = e.toError();
    if (error.kind() == ErrorKind.NEEDS_REBALANCE) {
      error = new MutationError(ErrorKind.CONFLICT, error.message());
    }
    logger.log(Level.FINE, "{0} rejected: {1}", new Object[] {operation, error});
    metrics.incrementRejected(error.kind());
    return MutationResult.rejected(error);
  }

  /**
   * @return {@code false} if interrupted
   */
  private static boolean sleep(long delayMs) {
    try {
      Thread.sleep(delayMs);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  /** Builder for {@link KanbanClient}. */
  public static final class Builder {
    private MutationEngine engine;
    private RetryPolicy retryPolicy;
    private int maxAttempts = 3;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the engine that executes the operations.
     *
     * <p><b>Required.</b>
     *
     * @param engine the mutation engine
     * @return this builder
     */
    public Builder engine(MutationEngine engine) {
      this.engine = engine;
      return this;
    }

    /**
     * Sets the backoff between attempts of a request that failed with
     * {@link ErrorKind#STORE_UNAVAILABLE}.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with
     * {@code baseDelayMs=50} and {@code maxDelayMs=2000}.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the maximum number of attempts per request, the first included.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 1; {@code 1} disables retries.
     *
     * @param maxAttempts maximum attempts
     * @return this builder
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Sets the metrics exporter that counts rejected requests.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * @throws NullPointerException if {@code engine} is null
     * @throws IllegalArgumentException if {@code maxAttempts < 1}
     */
    public KanbanClient build() {
      return new KanbanClient(this);
    }
  }
}
