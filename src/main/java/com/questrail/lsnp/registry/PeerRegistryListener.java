package com.questrail.lsnp.registry;

import com.questrail.lsnp.model.Peer;

/**
 * Membership callbacks from {@link PeerRegistry}. Invoked outside the
 * registry lock, on whichever thread caused the change.
 */
public interface PeerRegistryListener
{
    void onPeerJoined(Peer peer);

    void onPeerLeft(Peer peer);
}
