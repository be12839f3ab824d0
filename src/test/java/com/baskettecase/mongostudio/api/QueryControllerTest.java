package com.baskettecase.mongostudio.api;

import com.baskettecase.mongostudio.connection.ConnectionProfile;
import com.baskettecase.mongostudio.connection.ConnectionStore;
import com.baskettecase.mongostudio.connection.ResolvedConnection;
import com.baskettecase.mongostudio.exception.ConnectionFailedException;
import com.baskettecase.mongostudio.exception.QueryParseException;
import com.baskettecase.mongostudio.query.QueryExecutor;
import com.baskettecase.mongostudio.query.ResultPage;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web layer tests for QueryController
 */
@ExtendWith(MockitoExtension.class)
class QueryControllerTest {

    @Mock
    private ConnectionStore connectionStore;

    @Mock
    private QueryExecutor queryExecutor;

    private MockMvc mockMvc;
    private ResolvedConnection connection;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new QueryController(connectionStore, queryExecutor))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
        connection = new ResolvedConnection(new ConnectionProfile("local", "localhost", 27017, "test", null, false), "");
    }

    @Test
    void testListCollections() throws Exception {
        when(connectionStore.resolve("local")).thenReturn(connection);
        when(queryExecutor.listCollections(connection)).thenReturn(List.of("orders", "customers"));

        mockMvc.perform(get("/api/v1/connections/local/collections"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0]").value("orders"))
            .andExpect(jsonPath("$[1]").value("customers"));
    }

    @Test
    void testQueryAsJsonObject() throws Exception {
        ObjectId id = new ObjectId("5f1d7f3c9b1e8a3d4c2b1a09");
        when(connectionStore.resolve("local")).thenReturn(connection);
        when(queryExecutor.execute(eq(connection), eq("orders"), eq("{\"status\":\"open\"}"), isNull(), isNull(),
                eq(2), eq(10)))
            .thenReturn(ResultPage.of(List.of(new Document("_id", id).append("status", "open")), 2, 10));

        mockMvc.perform(post("/api/v1/connections/local/collections/orders/query")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\": {\"status\": \"open\"}, \"page\": 2, \"pageSize\": 10}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.documents[0]._id['$oid']").value("5f1d7f3c9b1e8a3d4c2b1a09"))
            .andExpect(jsonPath("$.page").value(2))
            .andExpect(jsonPath("$.totalKnown").value(11))
            .andExpect(jsonPath("$.hasMore").value(false));
    }

    @Test
    void testQueryAsTextDefaultsToFirstPage() throws Exception {
        when(connectionStore.resolve("local")).thenReturn(connection);
        when(queryExecutor.execute(eq(connection), eq("orders"), eq("db.orders.find({})"), isNull(), isNull(),
                eq(1), eq(0)))
            .thenReturn(ResultPage.of(List.of(), 1, 50));

        mockMvc.perform(post("/api/v1/connections/local/collections/orders/query")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\": \"db.orders.find({})\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.documents").isEmpty());
    }

    @Test
    void testParseErrorIsBadRequest() throws Exception {
        when(connectionStore.resolve("local")).thenReturn(connection);
        when(queryExecutor.execute(any(), any(), any(), any(), any(), eq(1), eq(0)))
            .thenThrow(new QueryParseException("Invalid JSON: Unexpected character", null));

        mockMvc.perform(post("/api/v1/connections/local/collections/orders/query")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\": \"{status:}\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("ParseError"));
    }

    @Test
    void testUnreachableServerIsBadGateway() throws Exception {
        when(connectionStore.resolve("local")).thenReturn(connection);
        when(queryExecutor.listCollections(connection))
            .thenThrow(new ConnectionFailedException("Cannot reach MongoDB server for connection 'local'.", null));

        mockMvc.perform(get("/api/v1/connections/local/collections"))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.error").value("ConnectionFailed"));
    }

    @Test
    void testReplaceDocument() throws Exception {
        when(connectionStore.resolve("local")).thenReturn(connection);
        when(queryExecutor.replaceDocument(connection, "orders", "5f1d7f3c9b1e8a3d4c2b1a09", "{\"status\":\"closed\"}"))
            .thenReturn(true);

        mockMvc.perform(put("/api/v1/connections/local/collections/orders/documents/5f1d7f3c9b1e8a3d4c2b1a09")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\": \"closed\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.modified").value(true));
    }

    @Test
    void testUpdateIndex() throws Exception {
        when(connectionStore.resolve("local")).thenReturn(connection);
        when(queryExecutor.updateIndex(connection, "orders", "by_status", "{\"status\":1,\"createdAt\":-1}",
                "by_status_created", false))
            .thenReturn("by_status_created");

        mockMvc.perform(put("/api/v1/connections/local/collections/orders/indexes/by_status")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"keys\": {\"status\": 1, \"createdAt\": -1}, \"name\": \"by_status_created\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.name").value("by_status_created"));
    }
}
