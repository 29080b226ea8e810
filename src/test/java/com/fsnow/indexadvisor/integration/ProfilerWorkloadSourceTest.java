package com.fsnow.indexadvisor.integration;

import com.fsnow.indexadvisor.exception.SourceUnavailableException;
import com.fsnow.indexadvisor.model.OperationType;
import com.fsnow.indexadvisor.model.RawQuery;
import com.mongodb.MongoSocketException;
import com.mongodb.ServerAddress;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.MongoDatabase;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ProfilerWorkloadSourceTest {
    
    private MongoCursor<Document> cursor;
    private MongoCollection<Document> profile;
    private ProfilerWorkloadSource source;
    
    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        MongoClient client = mock(MongoClient.class);
        MongoDatabase database = mock(MongoDatabase.class);
        profile = mock(MongoCollection.class);
        FindIterable<Document> found = mock(FindIterable.class);
        cursor = mock(MongoCursor.class);
        
        when(client.getDatabase("shop")).thenReturn(database);
        when(database.getCollection("system.profile")).thenReturn(profile);
        when(profile.find(any(Bson.class))).thenReturn(found);
        when(found.sort(any(Bson.class))).thenReturn(found);
        when(found.iterator()).thenReturn(cursor);
        
        source = new ProfilerWorkloadSource(new MongoClientAdapter(client));
    }
    
    private List<RawQuery> drain(Iterable<RawQuery> queries) {
        List<RawQuery> result = new ArrayList<>();
        queries.forEach(result::add);
        return result;
    }
    
    @Test
    void testReadsAndParsesProfiledOperations() {
        Document find = new Document("op", "query")
                .append("command", new Document("find", "users").append("filter", new Document("name", "bob")));
        Document createIndexes = new Document("op", "command")
                .append("command", new Document("createIndexes", "users"));
        Document update = new Document("op", "update")
                .append("command", new Document("q", new Document("age", new Document("$gt", 30))));
        when(cursor.hasNext()).thenReturn(true, true, true, false);
        when(cursor.next()).thenReturn(find, createIndexes, update);
        
        List<RawQuery> queries = drain(source.queries("shop.users"));
        
        assertThat(queries).hasSize(2);
        assertThat(queries.get(0).getFilter()).isEqualTo(new Document("name", "bob"));
        assertThat(queries.get(1).getOperationType()).isEqualTo(OperationType.UPDATE);
        verify(profile).find(ProfilerWorkloadSource.profileFilter("shop.users"));
        verify(cursor).close();
    }
    
    @Test
    void testProfileFilterSelectsNamespaceAndOperations() {
        Document filter = ProfilerWorkloadSource.profileFilter("shop.users");
        
        assertThat(filter.getString("ns")).isEqualTo("shop.users");
        assertThat(filter.get("op", Document.class).getList("$in", String.class))
                .containsExactly("query", "update", "remove", "command");
    }
    
    @Test
    void testBrokenCursorIsUnavailable() {
        when(cursor.hasNext()).thenThrow(new MongoSocketException("connection reset", new ServerAddress()));
        
        Iterable<RawQuery> queries = source.queries("shop.users");
        
        assertThatThrownBy(() -> drain(queries)).isInstanceOf(SourceUnavailableException.class);
    }
}
