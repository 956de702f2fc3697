package io.httpreq.client.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.Test;

public class RequestContextTest {

    private static final HttpClient STUB = request -> new HttpResponse(204, new Headers(), null);

    @Test
    public void testBackgroundIsEmpty() {
        RequestContext context = RequestContext.background();

        assertFalse(context.client().isPresent());
        assertFalse(context.deadline().isPresent());
    }

    @Test
    public void testAttachClientDerivesNewContext() {
        RequestContext background = RequestContext.background();
        RequestContext attached = background.attachClient(STUB);

        assertSame(STUB, attached.client().orElseThrow());
        assertFalse(background.client().isPresent());
        assertSame(STUB, RequestContext.clientFrom(attached));
    }

    @Test
    public void testClientFromFallsBackToDefaultClient() {
        HttpClient resolved = RequestContext.clientFrom(RequestContext.background());

        assertSame(HttpClient.defaultClient(), resolved);
        assertSame(resolved, RequestContext.clientFrom(RequestContext.background()));
    }

    @Test
    public void testEarlierDeadlineWins() {
        Instant soon = Instant.now().plusSeconds(5);
        Instant later = soon.plusSeconds(60);

        RequestContext context = RequestContext.background().withDeadline(soon).withDeadline(later);
        assertEquals(soon, context.deadline().orElseThrow());

        context = RequestContext.background().withDeadline(later).withDeadline(soon);
        assertEquals(soon, context.deadline().orElseThrow());
    }

    @Test
    public void testWithTimeoutSetsDeadlineFromNow() {
        Instant before = Instant.now();
        RequestContext context = RequestContext.background().withTimeout(Duration.ofSeconds(30));

        Instant deadline = context.deadline().orElseThrow();
        assertTrue(!deadline.isBefore(before.plusSeconds(30)));
        assertTrue(deadline.isBefore(Instant.now().plusSeconds(31)));
    }

    @Test
    public void testDeadlineSurvivesClientAttachment() {
        Instant deadline = Instant.now().plusSeconds(5);
        RequestContext context = RequestContext.background().withDeadline(deadline).attachClient(STUB);

        assertEquals(deadline, context.deadline().orElseThrow());
    }

    @Test
    public void testAttributesAreCopiedOnWrite() {
        RequestContext first = RequestContext.background().withAttribute("tenant", "acme");
        RequestContext second = first.withAttribute("tenant", "globex").withAttribute("trace", 42);

        assertEquals("acme", first.attribute("tenant").orElseThrow());
        assertEquals("globex", second.attribute("tenant").orElseThrow());
        assertEquals(42, second.attribute("trace").orElseThrow());
        assertFalse(first.attribute("trace").isPresent());
        assertTrue(RequestContext.background().attributes().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> second.attributes().put("x", "y"));
    }

    @Test
    public void testAttributesSurviveDerivation() {
        RequestContext context = RequestContext.background()
                .withAttribute("tenant", "acme")
                .attachClient(STUB)
                .withTimeout(Duration.ofSeconds(5));

        assertEquals("acme", context.attribute("tenant").orElseThrow());
    }

    @Test
    public void testNullArguments() {
        assertThrows(IllegalArgumentException.class, () -> RequestContext.background().attachClient(null));
        assertThrows(IllegalArgumentException.class, () -> RequestContext.clientFrom(null));
        assertThrows(IllegalArgumentException.class, () -> RequestContext.background().withAttribute("k", null));
    }
}
