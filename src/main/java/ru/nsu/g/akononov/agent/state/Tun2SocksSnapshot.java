package ru.nsu.g.akononov.agent.state;

/**
 * Supervised tun2socks process. A pid of 0 means not running.
 */
public final class Tun2SocksSnapshot {
    public static final Tun2SocksSnapshot EMPTY = new Tun2SocksSnapshot(0, 0, false, false);

    private final int pid;
    private final long uptimeSec;
    private final boolean tcpOk;
    private final boolean udpOk;

    public Tun2SocksSnapshot(int pid, long uptimeSec, boolean tcpOk, boolean udpOk) {
        this.pid = pid;
        this.uptimeSec = uptimeSec;
        this.tcpOk = tcpOk;
        this.udpOk = udpOk;
    }

    public int getPid() {
        return pid;
    }

    public long getUptimeSec() {
        return uptimeSec;
    }

    public boolean isTcpOk() {
        return tcpOk;
    }

    public boolean isUdpOk() {
        return udpOk;
    }
}
