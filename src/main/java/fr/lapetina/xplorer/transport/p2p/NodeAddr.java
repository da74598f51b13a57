package fr.lapetina.xplorer.transport.p2p;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Dialable address of a node: its id plus the socket addresses it listens on.
 * <p>
 * Shared as a ticket {@code nodeId@host:port[,host:port...]}; IPv6 hosts are bracketed.
 *
 * @param nodeId          hex node id the peer must prove
 * @param directAddresses socket addresses to dial, in order
 */
public record NodeAddr(String nodeId, List<InetSocketAddress> directAddresses) {

    public NodeAddr {
        if (!NodeIdentity.isValidNodeId(nodeId)) {
            throw new IllegalArgumentException("Invalid node id: " + nodeId);
        }
        Objects.requireNonNull(directAddresses, "Direct addresses are required");
        if (directAddresses.isEmpty()) {
            throw new IllegalArgumentException("At least one direct address is required");
        }
        directAddresses = List.copyOf(directAddresses);
    }

    public String toTicket() {
        return nodeId + "@" + directAddresses.stream()
                .map(NodeAddr::formatAddress)
                .collect(Collectors.joining(","));
    }

    /**
     * @throws IllegalArgumentException if the ticket is malformed
     */
    public static NodeAddr parse(String ticket) {
        Objects.requireNonNull(ticket, "Ticket is required");
        int at = ticket.indexOf('@');
        if (at <= 0 || at == ticket.length() - 1) {
            throw new IllegalArgumentException("Ticket must be nodeId@host:port: " + ticket);
        }
        List<InetSocketAddress> addresses = new ArrayList<>();
        for (String part : ticket.substring(at + 1).split(",")) {
            addresses.add(parseAddress(part.trim()));
        }
        return new NodeAddr(ticket.substring(0, at), addresses);
    }

    private static String formatAddress(InetSocketAddress address) {
        String host = address.getHostString();
        return (host.indexOf(':') >= 0 ? "[" + host + "]" : host) + ":" + address.getPort();
    }

    private static InetSocketAddress parseAddress(String value) {
        int colon = value.lastIndexOf(':');
        if (colon <= 0 || colon == value.length() - 1) {
            throw new IllegalArgumentException("Address must be host:port: " + value);
        }
        String host = value.substring(0, colon);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        int port;
        try {
            port = Integer.parseInt(value.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in address: " + value, e);
        }
        return new InetSocketAddress(host, port);
    }

    @Override
    public String toString() {
        return toTicket();
    }
}
