package io.github.genie.snowflake.network;

import io.github.genie.snowflake.core.exception.NoPrivateAddressException;
import io.github.genie.snowflake.core.log.Log;
import io.github.genie.snowflake.core.support.IdentitySource;
import io.github.genie.snowflake.core.support.Layout;
import io.github.genie.snowflake.core.support.SnowflakeBuilder;
import org.jetbrains.annotations.NotNull;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Derives the machine id and data center id from a private address of this host. A site-local
 * IPv4 address is preferred, a unique-local or site-local IPv6 address is the fallback.
 * <p>
 * The machine id takes the lowest {@code machineIdBits} bits of the address and the data center
 * id the {@code dataCenterIdBits} bits right above them, so both always fit their segments and
 * never share a bit.
 */
public class PrivateAddressIdentity {

    private static final Log log = Log.get(PrivateAddressIdentity.class);

    private final Layout layout;
    private final Supplier<List<InetAddress>> candidates;

    private volatile InetAddress address;

    public PrivateAddressIdentity(@NotNull Layout layout) {
        this(layout, NetworkInterfaces::candidateAddresses);
    }

    public PrivateAddressIdentity(@NotNull Layout layout, @NotNull Supplier<List<InetAddress>> candidates) {
        this.layout = Objects.requireNonNull(layout);
        this.candidates = Objects.requireNonNull(candidates);
    }

    /**
     * Uses this identity's layout and both of its identity sources.
     */
    public SnowflakeBuilder applyTo(SnowflakeBuilder builder) {
        return builder.layout(layout)
                .machineId(machineIdSource())
                .dataCenterId(dataCenterIdSource());
    }

    public IdentitySource machineIdSource() {
        return () -> machineId(getAddress());
    }

    public IdentitySource dataCenterIdSource() {
        return () -> dataCenterId(getAddress());
    }

    public long machineId(InetAddress address) {
        return lowBits(address) & layout.getMaxMachineId();
    }

    public long dataCenterId(InetAddress address) {
        return lowBits(address) >>> layout.getMachineIdBits() & layout.getMaxDataCenterId();
    }

    public InetAddress getAddress() {
        InetAddress resolved = address;
        if (resolved == null) {
            synchronized (this) {
                resolved = address;
                if (resolved == null) {
                    resolved = select(candidates.get());
                    address = resolved;
                    InetAddress selected = resolved;
                    log.info(() -> "identity derived from " + selected.getHostAddress()
                                   + ": machine_id=" + machineId(selected)
                                   + ", data_center_id=" + dataCenterId(selected));
                }
            }
        }
        return resolved;
    }

    public Layout getLayout() {
        return layout;
    }

    static InetAddress select(List<InetAddress> addresses) {
        for (InetAddress address : addresses) {
            if (address instanceof Inet4Address && address.isSiteLocalAddress()) {
                return address;
            }
        }
        for (InetAddress address : addresses) {
            if (address instanceof Inet6Address && isPrivateIpv6(address)) {
                return address;
            }
        }
        throw new NoPrivateAddressException();
    }

    static boolean isPrivateIpv6(InetAddress address) {
        byte[] bytes = address.getAddress();
        // fc00::/7
        return (bytes[0] & 0xfe) == 0xfc || address.isSiteLocalAddress();
    }

    /**
     * @return the last (up to) 8 bytes of the address, big-endian
     */
    static long lowBits(InetAddress address) {
        byte[] bytes = address.getAddress();
        long bits = 0;
        for (int i = Math.max(0, bytes.length - Long.BYTES); i < bytes.length; i++) {
            bits = bits << 8 | bytes[i] & 0xff;
        }
        return bits;
    }

}
