package scraper;

import java.io.IOException;

// Opens a fresh exchange through the configured proxy for every attempt.
public interface ProxyTransport {

    ProxyExchange get(String url, String userAgent) throws IOException;
}
