package com.baskettecase.mongostudio.query;

import com.baskettecase.mongostudio.exception.InvalidQueryShapeException;
import com.baskettecase.mongostudio.exception.QueryParseException;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Date;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for QueryParser
 */
class QueryParserTest {

    private QueryParser parser;

    @BeforeEach
    void setUp() {
        parser = new QueryParser();
    }

    @Test
    void testObjectParsesAsFindFilter() {
        QuerySpec query = parser.parse("{\"status\": \"active\", \"age\": {\"$gt\": 30}}");

        assertEquals(QuerySpec.Kind.FIND, query.kind());
        assertEquals("active", query.filter().getString("status"));
        assertEquals(30, query.filter().get("age", Document.class).getInteger("$gt"));
        assertNull(query.collection());
    }

    @Test
    void testArrayParsesAsPipeline() {
        QuerySpec query = parser.parse("[{\"$match\": {\"x\": 1}}, {\"$count\": \"n\"}]");

        assertTrue(query.isAggregate());
        assertEquals(2, query.pipeline().size());
        assertTrue(query.pipeline().get(0).containsKey("$match"));
    }

    @Test
    void testBlankQueryMatchesEverything() {
        QuerySpec query = parser.parse("   ");

        assertEquals(QuerySpec.Kind.FIND, query.kind());
        assertTrue(query.filter().isEmpty());
    }

    @Test
    void testRelaxedSyntaxEqualsStrictJson() {
        QuerySpec strict = parser.parse("{\"status\": \"active\"}");
        QuerySpec relaxed = parser.parse("{status: 'active',}");

        assertEquals(strict.filter(), relaxed.filter());
    }

    @Test
    void testExtendedJsonObjectIdIsConverted() {
        QuerySpec query = parser.parse("{\"_id\": {\"$oid\": \"5f1d7f3c9b1e8a3d4c2b1a09\"}}");

        assertEquals(new ObjectId("5f1d7f3c9b1e8a3d4c2b1a09"), query.filter().get("_id"));
    }

    @Test
    void testShellHelpersAreConverted() {
        QuerySpec query = parser.parse(
            "{_id: ObjectId('5f1d7f3c9b1e8a3d4c2b1a09'), createdAt: {$gte: ISODate(\"2024-01-01T00:00:00Z\")}}");

        assertEquals(new ObjectId("5f1d7f3c9b1e8a3d4c2b1a09"), query.filter().get("_id"));
        assertInstanceOf(Date.class, query.filter().get("createdAt", Document.class).get("$gte"));
    }

    @Test
    void testShellFindWithProjection() {
        QuerySpec query = parser.parse("db.orders.find({status: 'open'}, {total: 1});");

        assertEquals("orders", query.collection());
        assertEquals(new Document("status", "open"), query.filter());
        assertEquals(new Document("total", 1), query.projection());
        assertFalse(query.single());
    }

    @Test
    void testShellFindOneIsSingle() {
        QuerySpec query = parser.parse("db.orders.findOne()");

        assertTrue(query.single());
        assertTrue(query.filter().isEmpty());
    }

    @Test
    void testShellGetCollectionAggregate() {
        QuerySpec query = parser.parse("db.getCollection(\"order-items\").aggregate([{$match: {qty: {$gt: 2}}}])");

        assertEquals("order-items", query.collection());
        assertTrue(query.isAggregate());
        assertEquals(1, query.pipeline().size());
    }

    @Test
    void testTargetCollectionPrefersShellCollection() {
        assertEquals("orders", parser.parse("db.orders.find({})").targetCollection("customers"));
        assertEquals("customers", parser.parse("{}").targetCollection("customers"));
    }

    @Test
    void testSeparateProjectionAndSort() {
        QuerySpec query = parser.parse("{}", "{name: 1}", "{createdAt: -1}");

        assertEquals(new Document("name", 1), query.projection());
        assertEquals(new Document("createdAt", -1), query.sort());
    }

    @Test
    void testMalformedJsonIsParseError() {
        QueryParseException e = assertThrows(QueryParseException.class, () -> parser.parse("{\"status\":}"));
        assertTrue(e.getMessage().startsWith("Invalid JSON"));
    }

    @Test
    void testTrailingContentIsParseError() {
        assertThrows(QueryParseException.class, () -> parser.parse("{\"a\": 1} {\"b\": 2}"));
    }

    @Test
    void testScalarIsInvalidShape() {
        assertThrows(InvalidQueryShapeException.class, () -> parser.parse("42"));
        assertThrows(InvalidQueryShapeException.class, () -> parser.parse("\"active\""));
    }

    @Test
    void testPipelineWithNonObjectStageIsInvalidShape() {
        assertThrows(InvalidQueryShapeException.class, () -> parser.parse("[{\"$match\": {}}, 5]"));
    }

    @Test
    void testProjectionMustBeObject() {
        assertThrows(InvalidQueryShapeException.class, () -> parser.parse("{}", "[1]", null));
    }

    @Test
    void testParseDocumentRequiresContent() {
        assertThrows(InvalidQueryShapeException.class, () -> parser.parseDocument("", "Index keys"));
        assertEquals(new Document("email", 1), parser.parseDocument("{email: 1}", "Index keys"));
    }

    @Test
    void testToIdConvertsOnlyHexIds() {
        assertEquals(new ObjectId("5f1d7f3c9b1e8a3d4c2b1a09"), QueryParser.toId("5f1d7f3c9b1e8a3d4c2b1a09"));
        assertEquals("user-42", QueryParser.toId("user-42"));
    }
}
