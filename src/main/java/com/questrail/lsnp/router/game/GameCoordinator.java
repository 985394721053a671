package com.questrail.lsnp.router.game;

import com.questrail.lsnp.api.GameNotFoundException;
import com.questrail.lsnp.api.InvalidMessageFormatException;
import com.questrail.lsnp.api.InvalidMoveException;
import com.questrail.lsnp.api.LsnpEvent;
import com.questrail.lsnp.api.RecipientUnknownException;
import com.questrail.lsnp.model.LsnpFields;
import com.questrail.lsnp.model.LsnpMessage;
import com.questrail.lsnp.model.MessageFactory;
import com.questrail.lsnp.model.MessageType;
import com.questrail.lsnp.model.Peer;
import com.questrail.lsnp.model.UserId;
import com.questrail.lsnp.registry.PeerRegistry;
import com.questrail.lsnp.transport.MessageSender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * GameCoordinator
 * =============================================================================
 * Tic-tac-toe over LSNP.
 *
 * <h2>Flow</h2>
 * <pre>
 *   inviter                                  invitee
 *   inviteToGame ── TICTACTOE_INVITE ──────▶ onInvite      (auto-accepted)
 *   makeMove     ── TICTACTOE_MOVE ────────▶ onMove
 *   onMove       ◀──────── TICTACTOE_MOVE ── makeMove
 *   ...
 *   (terminal move) ── TICTACTOE_MOVE ─────▶ onMove        (both sides evaluate)
 *                   ── TICTACTOE_RESULT ───▶ onResult
 * </pre>
 *
 * <p>Both nodes keep a mirror of the session and run the same
 * {@link TicTacToeReducer}. Local moves that the reducer rejects throw and
 * send nothing; inbound moves it rejects are logged and dropped.</p>
 *
 * <p>Game ids come from a wrapping counter; ids still held by an active local
 * session are skipped.</p>
 */
public final class GameCoordinator
{
    private static final Logger log = LoggerFactory.getLogger(GameCoordinator.class);

    private final MessageFactory messages;
    private final PeerRegistry registry;
    private final MessageSender sender;
    private final Consumer<LsnpEvent> events;

    private final TicTacToeReducer reducer = new TicTacToeReducer();
    private final GameIdAllocator ids = new GameIdAllocator();
    private final GameSessionTable sessions = new GameSessionTable();

    public GameCoordinator(MessageFactory messages,
                           PeerRegistry registry,
                           MessageSender sender,
                           Consumer<LsnpEvent> events)
    {
        this.messages = Objects.requireNonNull(messages, "messages");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.events = Objects.requireNonNull(events, "events");
    }

    // ---------------------------------------------------------------------
    // Outbound
    // ---------------------------------------------------------------------

    /**
     * Invites {@code opponent}. The invitation counts as accepted at once.
     *
     * @param mySymbol      symbol the local user plays
     * @param firstPosition optional opening move, only allowed when playing X
     * @throws RecipientUnknownException if {@code opponent} is not a known peer
     * @throws InvalidMoveException      if an opening move is given while playing O,
     *                                   or its position is out of range
     */
    public GameSession inviteToGame(UserId opponent, Symbol mySymbol, OptionalInt firstPosition)
    {
        Objects.requireNonNull(opponent, "opponent");
        Objects.requireNonNull(mySymbol, "mySymbol");
        Objects.requireNonNull(firstPosition, "firstPosition");

        Peer peer = registry.lookup(opponent).orElseThrow(() -> new RecipientUnknownException(opponent));

        GameSession session = GameSession.invited(allocateId(), messages.self(), mySymbol, opponent);
        if (firstPosition.isPresent()) {
            session = reducer.apply(session, mySymbol, firstPosition.getAsInt()).newSession();
        }

        LsnpMessage.Builder invite = messages.beginTo(MessageType.TICTACTOE_INVITE, opponent)
                .put(LsnpFields.GAME_ID, session.gameId())
                .put(LsnpFields.SYMBOL, mySymbol.name());
        if (firstPosition.isPresent()) {
            invite.put(LsnpFields.POSITION, firstPosition.getAsInt())
                  .put(LsnpFields.TURN, session.turnNumber());
        }
        sender.sendTo(peer.address(), invite.build());

        sessions.store(session);
        events.accept(new LsnpEvent.GameUpdated(session));
        return session;
    }

    /**
     * Plays the local user's symbol at {@code position} (1..9).
     *
     * @throws GameNotFoundException if no active game has this id
     * @throws InvalidMoveException  if the move is not legal now
     */
    public GameSession makeMove(String gameId, int position)
    {
        Objects.requireNonNull(gameId, "gameId");

        GameSession session = sessions.get(gameId).orElseThrow(() -> new GameNotFoundException(gameId));
        Symbol mine = session.symbolOf(messages.self()).orElseThrow(() -> new InvalidMoveException(
                InvalidMoveException.Reason.NOT_A_PARTICIPANT, "Not a participant in " + gameId));
        UserId opponent = session.opponentOf(messages.self());
        Peer peer = registry.lookup(opponent).orElseThrow(() -> new RecipientUnknownException(opponent));

        TicTacToeReducer.Result result = reducer.apply(session, mine, position);
        GameSession next = result.newSession();

        sender.sendTo(peer.address(), messages.beginTo(MessageType.TICTACTOE_MOVE, opponent)
                .put(LsnpFields.GAME_ID, gameId)
                .put(LsnpFields.POSITION, position)
                .put(LsnpFields.SYMBOL, mine.name())
                .put(LsnpFields.TURN, next.turnNumber())
                .build());

        result.outcome().ifPresent(outcome -> sender.sendTo(peer.address(), resultMessage(next, opponent, outcome)));

        sessions.store(next);
        events.accept(new LsnpEvent.GameUpdated(next));
        return next;
    }

    public Optional<GameSession> game(String gameId)
    {
        return sessions.get(gameId);
    }

    public List<GameSession> games()
    {
        return sessions.all();
    }

    // ---------------------------------------------------------------------
    // Inbound
    // ---------------------------------------------------------------------

    /**
     * An invite reusing the id of any active local game is dropped; the
     * local game is kept.
     */
    public void onInvite(LsnpMessage message)
    {
        UserId inviter = message.sender();
        String gameId = message.require(LsnpFields.GAME_ID);
        Symbol inviterSymbol = Symbol.parse(message.require(LsnpFields.SYMBOL));

        Optional<GameSession> clash = sessions.get(gameId);
        if (clash.isPresent()) {
            log.warn("Ignoring invite {} from {}: id in use by an active game with {}",
                    gameId, inviter, clash.get().opponentOf(messages.self()));
            return;
        }

        GameSession session = GameSession.invited(gameId, inviter, inviterSymbol, messages.self());
        if (message.has(LsnpFields.POSITION)) {
            try {
                session = reducer.apply(session, inviterSymbol, message.requireInt(LsnpFields.POSITION)).newSession();
            } catch (InvalidMoveException e) {
                log.warn("Ignoring invite {} from {}: opening move rejected: {}", gameId, inviter, e.getMessage());
                return;
            }
        }

        sessions.store(session);
        log.info("{} invited us to {} as {}", inviter, gameId, inviterSymbol);
        events.accept(new LsnpEvent.GameUpdated(session));
    }

    public void onMove(LsnpMessage message)
    {
        UserId from = message.sender();
        String gameId = message.require(LsnpFields.GAME_ID);
        int position = message.requireInt(LsnpFields.POSITION);

        Optional<GameSession> current = sessions.get(gameId);
        if (current.isEmpty()) {
            log.debug("Ignoring move for unknown game {} from {}", gameId, from);
            return;
        }
        GameSession session = current.get();

        Optional<Symbol> theirs = session.symbolOf(from);
        if (theirs.isEmpty() || from.equals(messages.self())) {
            log.warn("Ignoring move in {} from non-participant {}", gameId, from);
            return;
        }
        if (message.has(LsnpFields.SYMBOL) && Symbol.parse(message.require(LsnpFields.SYMBOL)) != theirs.get()) {
            log.warn("Ignoring move in {} from {}: SYMBOL does not match assigned {}", gameId, from, theirs.get());
            return;
        }

        final TicTacToeReducer.Result result;
        try {
            result = reducer.apply(session, theirs.get(), position);
        } catch (InvalidMoveException e) {
            log.warn("Ignoring move in {} from {}: {}", gameId, from, e.getMessage());
            return;
        }

        sessions.store(result.newSession());
        events.accept(new LsnpEvent.GameUpdated(result.newSession()));
    }

    public void onResult(LsnpMessage message)
    {
        UserId from = message.sender();
        String gameId = message.require(LsnpFields.GAME_ID);

        Optional<GameSession> current = sessions.get(gameId);
        if (current.isEmpty() || !current.get().isParticipant(from)) {
            // Usual case: the final move already completed and purged the session.
            log.debug("Result for {} from {} needs no action", gameId, from);
            return;
        }

        sessions.remove(gameId);
        GameSession completed = current.get().completedWith(parseOutcome(message));
        log.info("Game {} with {} completed: {}", gameId, from, completed.outcome());
        events.accept(new LsnpEvent.GameUpdated(completed));
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private String allocateId()
    {
        for (int attempt = 0; attempt < GameIdAllocator.ID_SPACE; attempt++) {
            String id = ids.next();
            if (!sessions.contains(id)) {
                return id;
            }
        }
        throw new IllegalStateException("All " + GameIdAllocator.ID_SPACE + " game ids are in use");
    }

    private LsnpMessage resultMessage(GameSession session, UserId opponent, GameOutcome outcome)
    {
        LsnpMessage.Builder b = messages.beginTo(MessageType.TICTACTOE_RESULT, opponent)
                .put(LsnpFields.GAME_ID, session.gameId());
        if (outcome instanceof GameOutcome.Win win) {
            b.put(LsnpFields.RESULT, "WIN")
             .put(LsnpFields.SYMBOL, win.symbol().name())
             .put(LsnpFields.WINNING_LINE, win.line().stream().map(String::valueOf).collect(Collectors.joining(",")));
        } else {
            b.put(LsnpFields.RESULT, "DRAW");
        }
        return b.build();
    }

    private static GameOutcome parseOutcome(LsnpMessage message)
    {
        String result = message.require(LsnpFields.RESULT).trim();
        if ("DRAW".equalsIgnoreCase(result)) {
            return new GameOutcome.Draw();
        }
        if (!"WIN".equalsIgnoreCase(result)) {
            throw new InvalidMessageFormatException("RESULT must be WIN or DRAW: '" + result + "'");
        }

        Symbol symbol = Symbol.parse(message.require(LsnpFields.SYMBOL));
        List<Integer> line = new ArrayList<>();
        for (String p : message.require(LsnpFields.WINNING_LINE).split(",")) {
            try {
                line.add(Integer.parseInt(p.trim()));
            } catch (NumberFormatException e) {
                throw new InvalidMessageFormatException("WINNING_LINE is not a list of positions", e);
            }
        }
        if (line.size() != 3) {
            throw new InvalidMessageFormatException("WINNING_LINE must name three positions");
        }
        return new GameOutcome.Win(symbol, line);
    }
}
