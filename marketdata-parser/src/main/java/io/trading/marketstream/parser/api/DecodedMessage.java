package io.trading.marketstream.parser.api;

import io.trading.marketstream.parser.model.FeedKind;
import io.trading.marketstream.parser.model.MarketEvent;
import io.trading.marketstream.parser.model.Symbol;

import java.util.List;
import java.util.Objects;

/**
 * Result of decoding a raw exchange message.
 *
 * @param kind      What the message is
 * @param feedKind  Feed of the payload, only for {@link Kind#EVENT}
 * @param symbol    Symbol of the payload, only for {@link Kind#EVENT}
 * @param parameter Stream parameter (kline interval code, book depth), may be null
 * @param events    Decoded payloads in arrival order, empty unless {@link Kind#EVENT}
 * @param detail    Free text for control and rejection messages
 */
public record DecodedMessage(
    Kind kind,
    FeedKind feedKind,
    Symbol symbol,
    String parameter,
    List<MarketEvent> events,
    String detail
) {

    /**
     * Message categories produced by decoders.
     */
    public enum Kind {
        /** Market data payload. */
        EVENT,
        /** Application-level liveness reply. */
        PONG,
        /** Acknowledgement or other control traffic with no data. */
        CONTROL,
        /** The exchange refused a request. */
        REJECTED
    }

    public DecodedMessage {
        Objects.requireNonNull(kind, "kind cannot be null");
        events = events == null ? List.of() : List.copyOf(events);
        if (kind == Kind.EVENT && (feedKind == null || symbol == null || events.isEmpty())) {
            throw new IllegalArgumentException("event messages need feedKind, symbol and at least one event");
        }
    }

    public static DecodedMessage event(MarketEvent event, String parameter) {
        return new DecodedMessage(Kind.EVENT, event.feedKind(), event.symbol(), parameter, List.of(event), null);
    }

    /**
     * Creates an event message carrying several payloads of the same feed and symbol.
     */
    public static DecodedMessage events(List<? extends MarketEvent> events, String parameter) {
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("events cannot be empty");
        }
        MarketEvent first = events.get(0);
        return new DecodedMessage(Kind.EVENT, first.feedKind(), first.symbol(), parameter, List.copyOf(events), null);
    }

    public static DecodedMessage pong() {
        return new DecodedMessage(Kind.PONG, null, null, null, List.of(), null);
    }

    public static DecodedMessage control(String detail) {
        return new DecodedMessage(Kind.CONTROL, null, null, null, List.of(), detail);
    }

    public static DecodedMessage rejected(String detail) {
        return new DecodedMessage(Kind.REJECTED, null, null, null, List.of(), detail);
    }

    public boolean isEvent() {
        return kind == Kind.EVENT;
    }
}
