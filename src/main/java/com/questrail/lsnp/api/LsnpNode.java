package com.questrail.lsnp.api;

import com.questrail.lsnp.model.DmEntry;
import com.questrail.lsnp.model.Group;
import com.questrail.lsnp.model.Peer;
import com.questrail.lsnp.model.PeerProfile;
import com.questrail.lsnp.model.Post;
import com.questrail.lsnp.model.UserId;
import com.questrail.lsnp.router.game.GameSession;
import com.questrail.lsnp.router.game.Symbol;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * LsnpNode
 * =============================================================================
 * The surface a UI or collaborator drives.
 *
 * <h2>Outbound intents</h2>
 * Intents run on the caller's thread. Each one either sends its datagram(s)
 * and updates local state, or throws an {@link LsnpException} subclass and
 * sends nothing.
 *
 * <h2>Inbound events</h2>
 * Inbound traffic is reported through {@link LsnpEventListener}s registered
 * on the runtime. Listeners are called on the receive loop (or the scheduler
 * thread for {@link LsnpEvent.PeerLeft}) and must not block.
 *
 * <h2>Queries</h2>
 * Queries return immutable snapshots.
 */
public interface LsnpNode
{
    // -------------------------------------------------------------------------
    // Outbound intents
    // -------------------------------------------------------------------------

    Post post(String content);

    /**
     * @throws RecipientUnknownException if {@code to} is not in the peer table
     */
    void sendDirectMessage(UserId to, String content);

    /**
     * @param avatarBytes raw image, or {@code null}
     * @param avatarMime  MIME type of the image, or {@code null} without one
     * @throws PayloadTooLargeException if the avatar is over the avatar limit
     */
    PeerProfile updateProfile(String displayName, String status, byte[] avatarBytes, String avatarMime);

    void follow(UserId target);

    void unfollow(UserId target);

    /**
     * Creates a group with us as creator. We are added to {@code members} if absent.
     *
     * @throws IllegalArgumentException if a group with this id already exists locally
     */
    Group createGroup(String groupId, String name, Set<UserId> members);

    /**
     * @throws GroupNotFoundException    if the group is unknown
     * @throws PermissionDeniedException if we did not create the group
     */
    Group updateGroup(String groupId, Set<UserId> add, Set<UserId> remove);

    /**
     * @throws GroupNotFoundException    if the group is unknown
     * @throws PermissionDeniedException if we are not a member
     */
    Group sendGroupMessage(String groupId, String content);

    void like(UserId author, String postId);

    void unlike(UserId author, String postId);

    /**
     * @param firstPosition opening move, only allowed when {@code mySymbol} is X
     */
    GameSession inviteToGame(UserId opponent, Symbol mySymbol, OptionalInt firstPosition);

    /**
     * @throws GameNotFoundException if no active game has this id
     * @throws InvalidMoveException  if the move breaks the rules; the board is unchanged
     */
    GameSession makeMove(String gameId, int position);

    void requestPeerList(UserId target);

    /**
     * Stops honouring one of our own tokens and asks every known peer to do the same.
     *
     * @throws IllegalArgumentException if {@code token} is malformed or not ours
     */
    void revokeToken(String token);

    // -------------------------------------------------------------------------
    // Queries
    // -------------------------------------------------------------------------

    UserId self();

    List<Peer> peers();

    List<DmEntry> directMessages(UserId counterpart);

    List<Group> groups();

    Set<UserId> likesOf(String postId);

    Set<UserId> following();

    Set<UserId> followers();

    List<Post> feed();

    Optional<GameSession> game(String gameId);
}
