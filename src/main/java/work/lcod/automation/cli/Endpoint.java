package work.lcod.automation.cli;

import work.lcod.automation.api.AutomationSettings;

/**
 * {@code host[:port]} as given to {@code --connect}.
 */
record Endpoint(String host, int port) {
    static Endpoint parse(String value, int defaultPort) {
        var trimmed = value.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Empty server address");
        }
        int colon = trimmed.lastIndexOf(':');
        if (colon < 0) {
            return new Endpoint(trimmed, defaultPort);
        }
        var host = colon == 0 ? AutomationSettings.DEFAULT_HOST : trimmed.substring(0, colon);
        try {
            int port = Integer.parseInt(trimmed.substring(colon + 1));
            if (port <= 0 || port > 65535) {
                throw new IllegalArgumentException("Port out of range in '" + value + "'");
            }
            return new Endpoint(host, port);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid server address '" + value + "', expected host:port", ex);
        }
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
