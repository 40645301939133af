package ru.nsu.g.akononov.agent.dnsResolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xbill.DNS.AAAARecord;
import org.xbill.DNS.ARecord;
import org.xbill.DNS.DClass;
import org.xbill.DNS.ExtendedResolver;
import org.xbill.DNS.Message;
import org.xbill.DNS.Name;
import org.xbill.DNS.Rcode;
import org.xbill.DNS.Record;
import org.xbill.DNS.Resolver;
import org.xbill.DNS.Section;
import org.xbill.DNS.Type;
import org.xbill.DNS.hosts.HostsFileParser;
import ru.nsu.g.akononov.agent.messages.connectionMessages.AddressType;
import ru.nsu.g.akononov.agent.probe.ProbeContext;

import java.io.Closeable;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.InetAddress;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves the proxy host for a probe run. IP literals are used as they are; names are looked up
 * in the hosts file and then with A and AAAA queries. Every wait is bounded by the run's
 * {@link ProbeContext}, and cancelling the context abandons a pending query.
 */
public class DnsResolver {
    private static final Logger logger = LoggerFactory.getLogger(DnsResolver.class.getSimpleName());

    private static final int[] QUERY_TYPES = {Type.A, Type.AAAA};

    private final Resolver resolver;
    private final HostsFileParser hostsFile;

    /**
     * Uses the system's configured name servers.
     */
    public DnsResolver() {
        this(new ExtendedResolver(), new HostsFileParser());
    }

    /**
     * @param hostsFile hosts file to consult before querying, {@code null} to skip it
     */
    public DnsResolver(Resolver resolver, HostsFileParser hostsFile) {
        this.resolver = resolver;
        this.hostsFile = hostsFile;
    }

    /**
     * @throws UnknownHostException if the name has no A or AAAA record
     * @throws SocketTimeoutException if the context's deadline passes first
     * @throws IOException if the context is cancelled or the query fails
     */
    public InetAddress resolve(ProbeContext context, String host) throws IOException {
        if (AddressType.of(host) != AddressType.DOMAIN_NAME) {
            return InetAddress.getByAddress(host, AddressType.toLiteralBytes(host));
        }

        Name name = Name.fromString(host, Name.root);
        for (int type : QUERY_TYPES) {
            Optional<InetAddress> fromHosts = lookupHostsFile(name, type);
            if (fromHosts.isPresent()) {
                return fromHosts.get();
            }
        }
        for (int type : QUERY_TYPES) {
            InetAddress address = query(context, name, type);
            if (address != null) {
                logger.debug("Resolved {} to {}", host, address.getHostAddress());
                return address;
            }
        }
        throw new UnknownHostException("no address for host " + host);
    }

    private Optional<InetAddress> lookupHostsFile(Name name, int type) {
        if (hostsFile == null) {
            return Optional.empty();
        }
        try {
            return hostsFile.getAddressForHost(name, type);
        } catch (IOException e) {
            logger.debug("Hosts file not usable, querying DNS for {}: {}", name, e.getMessage());
            return Optional.empty();
        }
    }

    private InetAddress query(ProbeContext context, Name name, int type) throws IOException {
        Message request = Message.newQuery(Record.newRecord(name, type, DClass.IN));
        CompletableFuture<Message> pending = resolver.sendAsync(request).toCompletableFuture();
        Closeable abandon = () -> pending.cancel(true);
        context.attach(abandon);
        try {
            int timeout = context.nextTimeoutMillis();
            Message response = timeout == 0 ? pending.get() : pending.get(timeout, TimeUnit.MILLISECONDS);
            return firstAddress(response, type);
        } catch (TimeoutException e) {
            throw new SocketTimeoutException("dns lookup of " + name + " timed out");
        } catch (CancellationException e) {
            throw new IOException("dns lookup of " + name + " cancelled");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof IOException) {
                throw (IOException) e.getCause();
            }
            throw new IOException("dns lookup of " + name + " failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("dns lookup of " + name + " interrupted");
        } finally {
            context.detach(abandon);
            pending.cancel(true);
        }
    }

    private static InetAddress firstAddress(Message response, int type) {
        if (response.getRcode() != Rcode.NOERROR) {
            return null;
        }
        for (Record record : response.getSection(Section.ANSWER)) {
            if (type == Type.A && record instanceof ARecord) {
                return ((ARecord) record).getAddress();
            }
            if (type == Type.AAAA && record instanceof AAAARecord) {
                return ((AAAARecord) record).getAddress();
            }
        }
        return null;
    }
}
