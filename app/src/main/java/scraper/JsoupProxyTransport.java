package scraper;

import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.Proxy;
import java.time.Duration;

// Fetches pages with Jsoup through a single fixed proxy.
public class JsoupProxyTransport implements ProxyTransport {

    private static final Logger log = LoggerFactory.getLogger(JsoupProxyTransport.class);

    private final ProxyEndpoint endpoint;
    private final Proxy proxy;
    private final Duration timeout;

    public JsoupProxyTransport(ProxyEndpoint endpoint, Duration timeout) {
        this.endpoint = endpoint;
        this.proxy = endpoint.toProxy();
        this.timeout = timeout;
    }

    @Override
    public ProxyExchange get(String url, String userAgent) throws IOException {
        Connection connection = Jsoup.connect(url)
                .proxy(proxy)
                .userAgent(userAgent)
                .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                .header("Accept-Language", "en-US,en;q=0.9")
                .header("Cache-Control", "no-cache")
                .header("Pragma", "no-cache")
                .timeout((int) timeout.toMillis())
                .followRedirects(true)
                // non-2xx replies come back as responses, not exceptions
                .ignoreHttpErrors(true)
                .ignoreContentType(true)
                // 0 = unlimited; never hand back a truncated body
                .maxBodySize(0);

        if (endpoint.type() == Proxy.Type.HTTP && endpoint.hasCredentials()) {
            connection.header("Proxy-Authorization", endpoint.basicAuthorization());
        }

        return new JsoupExchange(connection.execute());
    }

    // Wraps one executed response. Reading the body, in body() or close(), closes the connection.
    private static final class JsoupExchange implements ProxyExchange {
        private final Connection.Response response;
        private boolean read;

        private JsoupExchange(Connection.Response response) {
            this.response = response;
        }

        @Override
        public int statusCode() {
            return response.statusCode();
        }

        @Override
        public String body() throws IOException {
            read = true;
            try {
                response.bufferUp();
                return response.body();
            } catch (UncheckedIOException e) {
                throw e.getCause();
            }
        }

        // Drains an unread (non-200) reply so the connection is released. A failed drain keeps the status result.
        @Override
        public void close() {
            if (read) return;
            read = true;
            try {
                response.bufferUp();
            } catch (UncheckedIOException e) {
                log.debug("Could not drain {} reply from {}: {}", response.statusCode(), response.url(),
                        e.getCause().getMessage());
            }
        }
    }
}
