package ru.nsu.g.akononov.agent.state;

/**
 * TUN interface as last reported by its owner.
 */
public final class TunSnapshot {
    public static final TunSnapshot EMPTY = new TunSnapshot("", false, 0, "", "");

    private final String name;
    private final boolean up;
    private final int mtu;
    private final String localIp;
    private final String peerIp;

    public TunSnapshot(String name, boolean up, int mtu, String localIp, String peerIp) {
        this.name = name;
        this.up = up;
        this.mtu = mtu;
        this.localIp = localIp;
        this.peerIp = peerIp;
    }

    public String getName() {
        return name;
    }

    public boolean isUp() {
        return up;
    }

    public int getMtu() {
        return mtu;
    }

    public String getLocalIp() {
        return localIp;
    }

    public String getPeerIp() {
        return peerIp;
    }
}
