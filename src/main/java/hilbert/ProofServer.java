package hilbert;

import org.java_websocket.WebSocket;
import org.java_websocket.handshake.ClientHandshake;
import org.java_websocket.server.WebSocketServer;
import org.json.JSONObject;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * WebSocket front end: every text message is a proof document, answered with the
 * JSON report of its proofs.
 */
public class ProofServer extends WebSocketServer {

    private final ProofRunner runner;

    public ProofServer(int port, ProofRunner runner) {
        super(new InetSocketAddress(port));
        this.runner = Objects.requireNonNull(runner);
    }

    /** Builds the reply for one message. Never throws. */
    String respond(String message) {
        var proofs = ProofDocument.split(message);
        if (proofs.isEmpty())
            return new JSONObject().put("error", "No proof lines in message").toString();
        try {
            return ProofRunner.toJson(runner.run(proofs)).toString();
        } catch (RuntimeException e) {
            System.err.println("Error checking proofs: " + e);
            return new JSONObject().put("error", String.valueOf(e.getMessage())).toString();
        }
    }

    public void stopServer() {
        System.out.println("Stopping proof server...");
        try {
            stop(1000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("Interrupted while stopping proof server.");
        }
        System.out.println("Proof server stopped.");
    }

    @Override
    public void onOpen(WebSocket conn, ClientHandshake handshake) {
        System.out.println("WS Client connected: " + conn.getRemoteSocketAddress());
    }

    @Override
    public void onClose(WebSocket conn, int code, String reason, boolean remote) {
        System.out.println("WS Client disconnected: " + conn.getRemoteSocketAddress());
    }

    @Override
    public void onMessage(WebSocket conn, String message) {
        conn.send(respond(message));
    }

    @Override
    public void onError(WebSocket conn, Exception ex) {
        System.err.println("WS Error from " + (conn != null ? conn.getRemoteSocketAddress() : "server") + ": " + ex);
    }

    @Override
    public void onStart() {
        System.out.println("Proof server listening on port " + getPort());
    }
}
