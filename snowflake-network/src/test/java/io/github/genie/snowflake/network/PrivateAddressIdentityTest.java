package io.github.genie.snowflake.network;

import io.github.genie.snowflake.core.exception.IdentityField;
import io.github.genie.snowflake.core.exception.IdentitySourceException;
import io.github.genie.snowflake.core.exception.NoPrivateAddressException;
import io.github.genie.snowflake.core.support.DecomposedId;
import io.github.genie.snowflake.core.support.Layout;
import io.github.genie.snowflake.core.support.SnowflakeIdGenerator;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PrivateAddressIdentityTest {

    @Test
    void prefersPrivateIpv4() throws UnknownHostException {
        InetAddress ipv6 = address("fd12:3456:789a::1");
        InetAddress publicIpv4 = address("8.8.8.8");
        InetAddress privateIpv4 = address("192.168.3.77");

        InetAddress selected = PrivateAddressIdentity.select(Arrays.asList(ipv6, publicIpv4, privateIpv4));

        assertThat(selected).isEqualTo(privateIpv4);
    }

    @Test
    void recognizesEveryPrivateIpv4Range() throws UnknownHostException {
        for (String host : new String[]{"10.1.2.3", "172.16.0.1", "172.31.255.254", "192.168.0.1"}) {
            assertThat(PrivateAddressIdentity.select(Collections.singletonList(address(host))))
                    .isEqualTo(address(host));
        }
        assertThatThrownBy(() -> PrivateAddressIdentity.select(Collections.singletonList(address("172.32.0.1"))))
                .isInstanceOf(NoPrivateAddressException.class);
    }

    @Test
    void fallsBackToUniqueLocalIpv6() throws UnknownHostException {
        InetAddress linkLocal = address("fe80::1");
        InetAddress uniqueLocal = address("fd00::abcd");

        InetAddress selected = PrivateAddressIdentity.select(Arrays.asList(address("8.8.4.4"), linkLocal, uniqueLocal));

        assertThat(selected).isEqualTo(uniqueLocal);
    }

    @Test
    void failsWithoutPrivateAddress() throws UnknownHostException {
        List<InetAddress> addresses = Arrays.asList(address("1.1.1.1"), address("2001:db8::1"));

        assertThatThrownBy(() -> PrivateAddressIdentity.select(addresses))
                .isInstanceOf(NoPrivateAddressException.class);
        assertThatThrownBy(() -> PrivateAddressIdentity.select(Collections.emptyList()))
                .isInstanceOf(NoPrivateAddressException.class);
    }

    @Test
    void identitiesComeFromDisjointAddressBits() throws UnknownHostException {
        PrivateAddressIdentity identity = new PrivateAddressIdentity(Layout.DEFAULT);
        // 192.168.3.77 -> ...0000_0011_0100_1101
        InetAddress address = address("192.168.3.77");

        assertThat(identity.machineId(address)).isEqualTo(0b01101);
        assertThat(identity.dataCenterId(address)).isEqualTo(0b11010);
    }

    @Test
    void identitiesAlwaysFitTheirSegments() throws UnknownHostException {
        Layout layout = Layout.withoutDataCenter(41, 12, 10);
        PrivateAddressIdentity identity = new PrivateAddressIdentity(layout);
        InetAddress address = address("fd00::ffff:ffff");

        assertThat(identity.machineId(address)).isEqualTo(1023);
        assertThat(identity.dataCenterId(address)).isZero();
    }

    @Test
    void buildsGeneratorFromResolvedAddress() throws UnknownHostException {
        AtomicInteger scans = new AtomicInteger();
        InetAddress address = address("10.0.3.77");
        PrivateAddressIdentity identity = new PrivateAddressIdentity(Layout.DEFAULT, () -> {
            scans.incrementAndGet();
            return Collections.singletonList(address);
        });

        SnowflakeIdGenerator generator = identity.applyTo(SnowflakeIdGenerator.builder()).build();
        DecomposedId parts = generator.decompose(generator.nextId());

        assertThat(scans).hasValue(1);
        assertThat(generator.getMachineId()).isEqualTo(13);
        assertThat(generator.getDataCenterId()).isEqualTo(26);
        assertThat(parts.getMachineId()).isEqualTo(13);
        assertThat(parts.getDataCenterId()).isEqualTo(26);
    }

    @Test
    void missingAddressFailsTheBuild() {
        PrivateAddressIdentity identity = new PrivateAddressIdentity(Layout.DEFAULT, Collections::emptyList);

        assertThatThrownBy(() -> identity.applyTo(SnowflakeIdGenerator.builder()).build())
                .isInstanceOf(IdentitySourceException.class)
                .hasCauseInstanceOf(NoPrivateAddressException.class)
                .satisfies(e -> assertThat(((IdentitySourceException) e).getField()).isEqualTo(IdentityField.MACHINE_ID));
    }

    @Test
    void scansLocalInterfaces() {
        List<InetAddress> addresses = NetworkInterfaces.candidateAddresses();

        assertThat(addresses).noneMatch(InetAddress::isLoopbackAddress);
    }

    private static InetAddress address(String literal) throws UnknownHostException {
        return InetAddress.getByName(literal);
    }

}
