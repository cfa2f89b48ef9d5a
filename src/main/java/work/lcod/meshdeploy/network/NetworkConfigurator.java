package work.lcod.meshdeploy.network;

import java.net.InetAddress;

/**
 * Host firewall setup that lets mesh traffic reach a machine.
 */
public interface NetworkConfigurator {
    void configure(InetAddress machineIp);

    void cleanup();
}
