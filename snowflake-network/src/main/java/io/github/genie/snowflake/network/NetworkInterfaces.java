package io.github.genie.snowflake.network;

import io.github.genie.snowflake.core.exception.NoPrivateAddressException;

import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;

final class NetworkInterfaces {

    private NetworkInterfaces() {
    }

    /**
     * @return addresses bound to interfaces that are up and not loopback, in interface order
     */
    static List<InetAddress> candidateAddresses() {
        List<InetAddress> addresses = new ArrayList<>();
        try {
            Enumeration<NetworkInterface> interfaces = NetworkInterface.getNetworkInterfaces();
            if (interfaces == null) {
                return addresses;
            }
            for (NetworkInterface networkInterface : Collections.list(interfaces)) {
                if (networkInterface.isUp() && !networkInterface.isLoopback()) {
                    addresses.addAll(Collections.list(networkInterface.getInetAddresses()));
                }
            }
        } catch (SocketException e) {
            throw new NoPrivateAddressException(e);
        }
        return addresses;
    }

}
