package com.fintech.scanner.ingestion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.scanner.config.ScannerProperties;
import com.fintech.scanner.domain.TickerSnapshot;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Bybit v5 public market data client.
 *
 * Calls {@code GET /v5/market/tickers?category=linear} and keeps the entries whose symbol
 * ends with the quote suffix. Bybit sends numbers as JSON strings, so every numeric field is
 * parsed explicitly; a missing or unparseable required field fails the whole snapshot.
 */
@Component
public class BybitMarketDataClient implements MarketDataClient {

    private static final Logger log = LoggerFactory.getLogger(BybitMarketDataClient.class);

    private final OkHttpClient http;
    private final ObjectMapper mapper;
    private final HttpUrl tickersUrl;
    private final String quoteSuffix;

    public BybitMarketDataClient(OkHttpClient http, ObjectMapper mapper, ScannerProperties properties) {
        ScannerProperties.MarketData config = properties.getMarketData();
        this.http = http;
        this.mapper = mapper;
        this.quoteSuffix = config.getQuoteSuffix();
        this.tickersUrl = HttpUrl.get(config.getBaseUrl()).newBuilder()
            .encodedPath(config.getTickersPath())
            .addQueryParameter("category", config.getCategory())
            .build();
        log.info("Bybit market data client: url={}, quoteSuffix={}", tickersUrl, quoteSuffix);
    }

    @Override
    public List<TickerSnapshot> fetchTickers() {
        Request request = new Request.Builder().url(tickersUrl).get().build();

        try (Response response = http.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new TickerFetchException(ErrorKind.HTTP_ERROR, "HTTP " + response.code() + " from " + tickersUrl);
            }
            return parse(body.string());

        } catch (TickerFetchException e) {
            throw e;
        } catch (IOException e) {
            throw new TickerFetchException(classify(e), "Ticker request failed: " + e.getMessage(), e);
        }
    }

    /**
     * Parses a tickers response body.
     *
     * @throws TickerFetchException with MALFORMED_RESPONSE or HTTP_ERROR
     */
    List<TickerSnapshot> parse(String body) {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new TickerFetchException(ErrorKind.MALFORMED_RESPONSE, "Response is not valid JSON", e);
        }

        JsonNode retCode = root.path("retCode");
        if (!retCode.isMissingNode() && retCode.asInt(-1) != 0) {
            throw new TickerFetchException(ErrorKind.HTTP_ERROR,
                "Bybit retCode=" + retCode.asText() + " retMsg=" + root.path("retMsg").asText(""));
        }

        JsonNode list = root.path("result").path("list");
        if (!list.isArray()) {
            throw new TickerFetchException(ErrorKind.MALFORMED_RESPONSE, "Missing result.list in tickers response");
        }

        List<TickerSnapshot> tickers = new ArrayList<>(list.size());
        for (JsonNode node : list) {
            String symbol = requiredText(node, "symbol");
            if (!symbol.endsWith(quoteSuffix)) {
                continue;
            }
            tickers.add(new TickerSnapshot(
                symbol,
                requiredNumber(node, "lastPrice", symbol),
                requiredNumber(node, "turnover24h", symbol),
                optionalNumber(node, "fundingRate", symbol)
            ));
        }
        return tickers;
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            throw new TickerFetchException(ErrorKind.MALFORMED_RESPONSE, "Ticker entry missing '" + field + "'");
        }
        return value.asText();
    }

    private static double requiredNumber(JsonNode node, String field, String symbol) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            throw new TickerFetchException(ErrorKind.MALFORMED_RESPONSE,
                symbol + " missing '" + field + "'");
        }
        return toDouble(value, field, symbol);
    }

    private static double optionalNumber(JsonNode node, String field, String symbol) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            return 0.0;
        }
        return toDouble(value, field, symbol);
    }

    private static double toDouble(JsonNode value, String field, String symbol) {
        double parsed;
        if (value.isNumber()) {
            parsed = value.doubleValue();
        } else {
            try {
                parsed = Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                throw new TickerFetchException(ErrorKind.MALFORMED_RESPONSE,
                    symbol + " has non-numeric '" + field + "': " + value.asText(), e);
            }
        }
        // parseDouble accepts "NaN" and "Infinity"
        if (!Double.isFinite(parsed)) {
            throw new TickerFetchException(ErrorKind.MALFORMED_RESPONSE,
                symbol + " has non-finite '" + field + "': " + value.asText());
        }
        return parsed;
    }

    /**
     * Maps an I/O failure to an ErrorKind. OkHttp reports call and read timeouts as
     * InterruptedIOException("timeout") as well as SocketTimeoutException.
     */
    static ErrorKind classify(IOException e) {
        if (e instanceof SocketTimeoutException) {
            return ErrorKind.TIMEOUT;
        }
        String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        if (e instanceof InterruptedIOException && message.contains("timeout")) {
            return ErrorKind.TIMEOUT;
        }
        if (e instanceof SocketException && message.contains("reset")) {
            return ErrorKind.CONNECTION_RESET;
        }
        return ErrorKind.GENERIC;
    }
}
