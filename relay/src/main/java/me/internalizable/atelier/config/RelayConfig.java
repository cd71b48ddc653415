package me.internalizable.atelier.config;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.introspector.Property;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;

import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Configuration for the Atelier relay.
 */
public class RelayConfig {

    // Network configuration
    private String bindAddress = "127.0.0.1";
    private int bindPort = 9003;
    private String websocketPath = "/";
    private String serverName = "atelier-relay";

    // Connection limits
    private int maxConnections = 1000;
    private int maxFrameBytes = 1024 * 1024;
    private int handshakeTimeoutSeconds = 10;

    // Heartbeats
    private int heartbeatIntervalSeconds = 20;
    private int heartbeatGraceSeconds = 10;

    // Commands
    private long commandTimeoutMillis = 30_000;
    private int maxPendingRequests = 10_000;
    private DeliveryMode deliveryMode = DeliveryMode.UNICAST;

    // Channels
    private String defaultChannel = "default";
    private ReconnectPolicy reconnectPolicy = ReconnectPolicy.REJOIN_REQUIRED;
    private int resumeWindowSeconds = 300;
    private Map<String, String> channelAdapters = new LinkedHashMap<>();

    // Debug options
    private boolean debugMode = false;

    public RelayConfig() {
        channelAdapters.put("default", "figma");
    }

    // ==================== Load / Save ====================

    public static RelayConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            RelayConfig config = new RelayConfig();
            config.save(path);
            return config;
        }

        LoaderOptions options = new LoaderOptions();
        Yaml yaml = new Yaml(new Constructor(RelayConfig.class, options));
        RelayConfig config;
        try (InputStream is = Files.newInputStream(path)) {
            config = yaml.load(is);
        }
        if (config == null) {
            config = new RelayConfig();
        }
        config.validate();
        return config;
    }

    public void save(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        DumperOptions dumperOptions = new DumperOptions();
        dumperOptions.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        dumperOptions.setPrettyFlow(true);
        dumperOptions.setIndent(2);
        dumperOptions.setIndicatorIndent(2);
        dumperOptions.setIndentWithIndicator(true);

        Representer representer = new Representer(dumperOptions) {
            @Override
            protected NodeTuple representJavaBeanProperty(Object javaBean, Property property,
                                                          Object propertyValue, Tag customTag) {
                if (propertyValue == null) {
                    return null;
                }
                return super.representJavaBeanProperty(javaBean, property, propertyValue, customTag);
            }

            @Override
            protected Set<Property> getProperties(Class<?> type) {
                Set<Property> props = super.getProperties(type);
                if (type == RelayConfig.class) {
                    return orderProperties(props,
                        "bindAddress", "bindPort", "websocketPath", "serverName",
                        "maxConnections", "maxFrameBytes", "handshakeTimeoutSeconds",
                        "heartbeatIntervalSeconds", "heartbeatGraceSeconds",
                        "commandTimeoutMillis", "maxPendingRequests", "deliveryMode",
                        "defaultChannel", "reconnectPolicy", "resumeWindowSeconds", "channelAdapters",
                        "debugMode"
                    );
                }
                return props;
            }

            private Set<Property> orderProperties(Set<Property> props, String... order) {
                Set<Property> ordered = new LinkedHashSet<>();
                for (String name : order) {
                    for (Property p : props) {
                        if (p.getName().equals(name)) {
                            ordered.add(p);
                            break;
                        }
                    }
                }
                for (Property p : props) {
                    if (!ordered.contains(p)) {
                        ordered.add(p);
                    }
                }
                return ordered;
            }
        };

        representer.addClassTag(RelayConfig.class, Tag.MAP);

        Yaml yaml = new Yaml(representer, dumperOptions);

        try (Writer writer = Files.newBufferedWriter(path)) {
            writer.write("# Atelier Relay Configuration\n");
            writer.write("# channelAdapters binds channel names to application adapters (figma, blender, photoshop)\n\n");
            yaml.dump(this, writer);
        }
    }

    /**
     * Reject values the relay cannot run with.
     *
     * @throws IllegalArgumentException naming the first offending key
     */
    public void validate() {
        requireThat(bindPort >= 0 && bindPort <= 65535, "bindPort must be between 0 and 65535");
        requireThat(websocketPath != null && websocketPath.startsWith("/"), "websocketPath must start with '/'");
        requireThat(maxConnections > 0, "maxConnections must be positive");
        requireThat(maxFrameBytes >= 1024, "maxFrameBytes must be at least 1024");
        requireThat(handshakeTimeoutSeconds > 0, "handshakeTimeoutSeconds must be positive");
        requireThat(heartbeatIntervalSeconds > 0, "heartbeatIntervalSeconds must be positive");
        requireThat(heartbeatGraceSeconds >= 0, "heartbeatGraceSeconds must not be negative");
        requireThat(commandTimeoutMillis > 0, "commandTimeoutMillis must be positive");
        requireThat(maxPendingRequests > 0, "maxPendingRequests must be positive");
        requireThat(deliveryMode != null, "deliveryMode is required");
        requireThat(reconnectPolicy != null, "reconnectPolicy is required");
        requireThat(resumeWindowSeconds > 0, "resumeWindowSeconds must be positive");
        requireThat(defaultChannel != null && !defaultChannel.isBlank(), "defaultChannel is required");
        requireThat(channelAdapters != null, "channelAdapters must not be null");
    }

    private static void requireThat(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException("Invalid relay configuration: " + message);
        }
    }

    // ==================== Network Getters/Setters ====================

    public String getBindAddress() { return bindAddress; }
    public void setBindAddress(String bindAddress) { this.bindAddress = bindAddress; }

    public int getBindPort() { return bindPort; }
    public void setBindPort(int bindPort) { this.bindPort = bindPort; }

    public String getWebsocketPath() { return websocketPath; }
    public void setWebsocketPath(String websocketPath) { this.websocketPath = websocketPath; }

    public String getServerName() { return serverName; }
    public void setServerName(String serverName) { this.serverName = serverName; }

    // ==================== Connection Getters/Setters ====================

    public int getMaxConnections() { return maxConnections; }
    public void setMaxConnections(int maxConnections) { this.maxConnections = maxConnections; }

    public int getMaxFrameBytes() { return maxFrameBytes; }
    public void setMaxFrameBytes(int maxFrameBytes) { this.maxFrameBytes = maxFrameBytes; }

    public int getHandshakeTimeoutSeconds() { return handshakeTimeoutSeconds; }
    public void setHandshakeTimeoutSeconds(int handshakeTimeoutSeconds) { this.handshakeTimeoutSeconds = handshakeTimeoutSeconds; }

    // ==================== Heartbeat Getters/Setters ====================

    public int getHeartbeatIntervalSeconds() { return heartbeatIntervalSeconds; }
    public void setHeartbeatIntervalSeconds(int heartbeatIntervalSeconds) { this.heartbeatIntervalSeconds = heartbeatIntervalSeconds; }

    public int getHeartbeatGraceSeconds() { return heartbeatGraceSeconds; }
    public void setHeartbeatGraceSeconds(int heartbeatGraceSeconds) { this.heartbeatGraceSeconds = heartbeatGraceSeconds; }

    // ==================== Command Getters/Setters ====================

    public long getCommandTimeoutMillis() { return commandTimeoutMillis; }
    public void setCommandTimeoutMillis(long commandTimeoutMillis) { this.commandTimeoutMillis = commandTimeoutMillis; }

    public int getMaxPendingRequests() { return maxPendingRequests; }
    public void setMaxPendingRequests(int maxPendingRequests) { this.maxPendingRequests = maxPendingRequests; }

    public DeliveryMode getDeliveryMode() { return deliveryMode; }
    public void setDeliveryMode(DeliveryMode deliveryMode) { this.deliveryMode = deliveryMode; }

    // ==================== Channel Getters/Setters ====================

    public String getDefaultChannel() { return defaultChannel; }
    public void setDefaultChannel(String defaultChannel) { this.defaultChannel = defaultChannel; }

    public ReconnectPolicy getReconnectPolicy() { return reconnectPolicy; }
    public void setReconnectPolicy(ReconnectPolicy reconnectPolicy) { this.reconnectPolicy = reconnectPolicy; }

    public int getResumeWindowSeconds() { return resumeWindowSeconds; }
    public void setResumeWindowSeconds(int resumeWindowSeconds) { this.resumeWindowSeconds = resumeWindowSeconds; }

    public Map<String, String> getChannelAdapters() { return channelAdapters; }
    public void setChannelAdapters(Map<String, String> channelAdapters) { this.channelAdapters = channelAdapters; }

    // ==================== Debug Getters/Setters ====================

    public boolean isDebugMode() { return debugMode; }
    public void setDebugMode(boolean debugMode) { this.debugMode = debugMode; }
}
