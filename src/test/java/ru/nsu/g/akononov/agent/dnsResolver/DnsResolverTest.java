package ru.nsu.g.akononov.agent.dnsResolver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.xbill.DNS.AAAARecord;
import org.xbill.DNS.DClass;
import org.xbill.DNS.Message;
import org.xbill.DNS.Name;
import org.xbill.DNS.Rcode;
import org.xbill.DNS.Resolver;
import org.xbill.DNS.Section;
import org.xbill.DNS.Type;
import ru.nsu.g.akononov.agent.probe.ProbeContext;

import java.net.InetAddress;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class DnsResolverTest {

    @Mock
    private Resolver resolver;

    @Test
    @DisplayName("Should return IP literals without querying")
    void resolve_Literal_NoQuery() throws Exception {
        DnsResolver dnsResolver = new DnsResolver(resolver, null);

        try (ProbeContext context = ProbeContext.background()) {
            assertThat(dnsResolver.resolve(context, "127.0.0.1").getHostAddress()).isEqualTo("127.0.0.1");
            assertThat(dnsResolver.resolve(context, "::1")).isEqualTo(InetAddress.getByName("::1"));
        }
        verifyNoInteractions(resolver);
    }

    @Test
    @DisplayName("Should fall back to AAAA when a name has no A record")
    void resolve_OnlyAaaa_ReturnsIpv6() throws Exception {
        Name name = Name.fromString("v6.example.");
        InetAddress v6 = InetAddress.getByName("2001:db8::1");
        when(resolver.sendAsync(any(Message.class))).thenAnswer(invocation -> {
            Message query = invocation.getArgument(0);
            Message response = new Message(query.getHeader().getID());
            response.getHeader().setRcode(Rcode.NOERROR);
            response.addRecord(query.getQuestion(), Section.QUESTION);
            if (query.getQuestion().getType() == Type.AAAA) {
                response.addRecord(new AAAARecord(name, DClass.IN, 60, v6), Section.ANSWER);
            }
            return CompletableFuture.completedFuture(response);
        });
        DnsResolver dnsResolver = new DnsResolver(resolver, null);

        try (ProbeContext context = ProbeContext.background()) {
            assertThat(dnsResolver.resolve(context, "v6.example")).isEqualTo(v6);
        }
    }

    @Test
    @DisplayName("Should report an unknown host when no address record exists")
    void resolve_NxDomain_Unknown() {
        when(resolver.sendAsync(any(Message.class))).thenAnswer(invocation -> {
            Message query = invocation.getArgument(0);
            Message response = new Message(query.getHeader().getID());
            response.getHeader().setRcode(Rcode.NXDOMAIN);
            return CompletableFuture.completedFuture(response);
        });
        DnsResolver dnsResolver = new DnsResolver(resolver, null);

        try (ProbeContext context = ProbeContext.background()) {
            assertThatThrownBy(() -> dnsResolver.resolve(context, "missing.example"))
                    .isInstanceOf(UnknownHostException.class)
                    .hasMessageContaining("missing.example");
        }
    }

    @Test
    @DisplayName("Should time out at the context deadline while a query is pending")
    void resolve_PendingPastDeadline_TimesOut() {
        CompletableFuture<Message> never = new CompletableFuture<>();
        when(resolver.sendAsync(any(Message.class))).thenReturn(never);
        DnsResolver dnsResolver = new DnsResolver(resolver, null);

        try (ProbeContext context = ProbeContext.background().withTimeout(Duration.ofMillis(100))) {
            assertThatThrownBy(() -> dnsResolver.resolve(context, "slow.example"))
                    .isInstanceOf(SocketTimeoutException.class)
                    .hasMessageContaining("timed out");
        }
        assertThat(never).isCancelled();
    }
}
