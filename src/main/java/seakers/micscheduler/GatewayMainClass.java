package seakers.micscheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import py4j.GatewayServer;
import seakers.micscheduler.gatewayclasses.SchedulingOperations;

public class GatewayMainClass {

    private static final Logger log = LoggerFactory.getLogger(GatewayMainClass.class);

    private final SchedulingOperations schedulingOperations;

    public GatewayMainClass() {
        this.schedulingOperations = new SchedulingOperations();
    }

    public SchedulingOperations getOperationsInstance() {
        return this.schedulingOperations;
    }

    public static void main(String[] args) {
        GatewayServer gatewayServer = new GatewayServer(new GatewayMainClass());
        gatewayServer.start();
        log.info("Gateway Server started on port {}", gatewayServer.getListeningPort());
    }

}
