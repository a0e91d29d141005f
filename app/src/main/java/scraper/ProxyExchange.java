package scraper;

import java.io.Closeable;
import java.io.IOException;

// One request/response over the proxy. Closing it releases the underlying connection.
public interface ProxyExchange extends Closeable {

    int statusCode();

    // Full decoded body. Throws if the body could not be read completely.
    String body() throws IOException;
}
