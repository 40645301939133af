package ru.nsu.g.akononov.agent.probe;

import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Single-connection SOCKS5 server for tests. It answers each stage with the bytes configured up
 * front and records what the client sent.
 */
final class ScriptedSocksServer implements AutoCloseable {
    static final byte[] BOUND_IPV4 = {0x01, 127, 0, 0, 1, 0x04, 0x38};
    static final byte[] BOUND_DOMAIN = {0x03, 4, 'p', 'r', 'o', 'x', 0x00, 0x50};
    static final byte[] BOUND_IPV6 = {0x04, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 1, 0x04, 0x38};

    private final ServerSocket serverSocket;
    private final Thread thread;
    private final CountDownLatch done = new CountDownLatch(1);

    private volatile boolean silent;
    private volatile byte replyVersion = 0x05;
    private volatile byte method = 0x00;
    private volatile byte authStatus = 0x00;
    private volatile byte connectReply = 0x00;
    private volatile byte[] connectBound = BOUND_IPV4;
    private volatile Byte udpReply;
    private volatile byte[] udpBound = BOUND_IPV4;

    private volatile byte[] greeting;
    private volatile byte[] userPass;
    private volatile byte[] connectRequest;
    private volatile byte[] udpRequest;
    private volatile boolean accepted;

    ScriptedSocksServer() throws IOException {
        serverSocket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
        thread = new Thread(this::serve, "scripted-socks-server");
        thread.setDaemon(true);
    }

    ScriptedSocksServer silent() {
        this.silent = true;
        return this;
    }

    ScriptedSocksServer replyVersion(int version) {
        this.replyVersion = (byte) version;
        return this;
    }

    ScriptedSocksServer method(int method) {
        this.method = (byte) method;
        return this;
    }

    ScriptedSocksServer authStatus(int status) {
        this.authStatus = (byte) status;
        return this;
    }

    ScriptedSocksServer connectReply(int rep, byte[] bound) {
        this.connectReply = (byte) rep;
        this.connectBound = bound;
        return this;
    }

    ScriptedSocksServer udpReply(int rep, byte[] bound) {
        this.udpReply = (byte) rep;
        this.udpBound = bound;
        return this;
    }

    ScriptedSocksServer start() {
        thread.start();
        return this;
    }

    String address() {
        return "127.0.0.1:" + serverSocket.getLocalPort();
    }

    byte[] greeting() {
        return greeting;
    }

    byte[] userPass() {
        return userPass;
    }

    byte[] connectRequest() {
        return connectRequest;
    }

    byte[] udpRequest() {
        return udpRequest;
    }

    boolean accepted() {
        return accepted;
    }

    void awaitDone() throws InterruptedException {
        done.await(5, TimeUnit.SECONDS);
    }

    private void serve() {
        try (Socket socket = serverSocket.accept()) {
            accepted = true;
            DataInputStream in = new DataInputStream(socket.getInputStream());
            OutputStream out = socket.getOutputStream();

            if (silent) {
                drain(in);
                return;
            }

            int version = in.readUnsignedByte();
            int count = in.readUnsignedByte();
            byte[] methods = new byte[count];
            in.readFully(methods);
            greeting = concat(new byte[]{(byte) version, (byte) count}, methods);

            out.write(new byte[]{replyVersion, method});
            out.flush();
            if (replyVersion != 0x05) {
                return;
            }

            if (method == 0x02) {
                ByteArrayOutputStream request = new ByteArrayOutputStream();
                request.write(in.readUnsignedByte());
                int userLength = in.readUnsignedByte();
                request.write(userLength);
                request.write(readN(in, userLength));
                int passLength = in.readUnsignedByte();
                request.write(passLength);
                request.write(readN(in, passLength));
                userPass = request.toByteArray();

                out.write(new byte[]{0x01, authStatus});
                out.flush();
                if (authStatus != 0x00) {
                    return;
                }
            } else if (method != 0x00) {
                return;
            }

            connectRequest = readRequest(in);
            out.write(concat(new byte[]{0x05, connectReply, 0x00}, connectBound));
            out.flush();
            if (connectReply != 0x00) {
                return;
            }

            if (udpReply != null) {
                udpRequest = readRequest(in);
                out.write(concat(new byte[]{0x05, udpReply, 0x00}, udpBound));
                out.flush();
            }
            drain(in);
        } catch (IOException ignored) {
            // client went away, the test asserts on what was recorded
        } finally {
            done.countDown();
        }
    }

    private static byte[] readRequest(DataInputStream in) throws IOException {
        byte[] header = readN(in, 4);
        int atyp = header[3];
        byte[] address;
        if (atyp == 0x01) {
            address = readN(in, 4);
        } else if (atyp == 0x04) {
            address = readN(in, 16);
        } else {
            int length = in.readUnsignedByte();
            address = concat(new byte[]{(byte) length}, readN(in, length));
        }
        return concat(concat(header, address), readN(in, 2));
    }

    private static byte[] readN(DataInputStream in, int n) throws IOException {
        byte[] bytes = new byte[n];
        in.readFully(bytes);
        return bytes;
    }

    private static void drain(DataInputStream in) throws IOException {
        while (in.read() != -1) {
            // wait for the client to hang up
        }
    }

    private static byte[] concat(byte[] a, byte[] b) {
        byte[] result = new byte[a.length + b.length];
        System.arraycopy(a, 0, result, 0, a.length);
        System.arraycopy(b, 0, result, a.length, b.length);
        return result;
    }

    @Override
    public void close() throws IOException {
        serverSocket.close();
    }
}
