package ru.nsu.g.akononov.agent.state;

/**
 * Capabilities of the upstream proxy learned by a probe. A {@code null} auth means unknown.
 */
public class ProxyFeatures {
    private String auth;
    private boolean ipv6;
    private boolean udp;

    public ProxyFeatures() {
    }

    public ProxyFeatures(String auth, boolean ipv6, boolean udp) {
        this.auth = auth;
        this.ipv6 = ipv6;
        this.udp = udp;
    }

    public ProxyFeatures copy() {
        return new ProxyFeatures(auth, ipv6, udp);
    }

    public String getAuth() {
        return auth;
    }

    public void setAuth(String auth) {
        this.auth = auth;
    }

    public boolean isIpv6() {
        return ipv6;
    }

    public void setIpv6(boolean ipv6) {
        this.ipv6 = ipv6;
    }

    /**
     * Reserved for payload-level UDP verification; a successful UDP ASSOCIATE alone does not set it.
     */
    public boolean isUdp() {
        return udp;
    }

    public void setUdp(boolean udp) {
        this.udp = udp;
    }
}
