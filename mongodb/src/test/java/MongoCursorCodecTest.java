import io.github.flameyossnowy.skeletal.api.options.SortOption;
import io.github.flameyossnowy.skeletal.api.options.SortOrder;
import io.github.flameyossnowy.skeletal.mongodb.MongoCursorCodec;
import org.bson.BsonDocument;
import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MongoCursorCodecTest {
    @Test
    void withoutOrdersResumesAfterTheId() {
        String cursor = MongoCursorCodec.encode(new Document("_id", "post:i:4").append("views", 10L), List.of());

        assertEquals(
            BsonDocument.parse("{_id: {$gt: 'post:i:4'}}"),
            MongoFilterBuilderTest.render(MongoCursorCodec.resumeFilter(cursor, List.of())));
    }

    @Test
    void resumeFilterBranchesOnEqualPrefixes() {
        List<SortOption> orders = List.of(
            new SortOption("views", SortOrder.DESCENDING),
            new SortOption("name", SortOrder.ASCENDING));
        Document last = new Document("_id", "post:i:4").append("views", 10L).append("name", "b");

        String cursor = MongoCursorCodec.encode(last, orders);

        assertEquals(BsonDocument.parse("""
                {$or: [
                  {views: {$lt: {$numberLong: '10'}}},
                  {$and: [{views: {$numberLong: '10'}}, {name: {$gt: 'b'}}]},
                  {$and: [{views: {$numberLong: '10'}}, {name: 'b'}, {_id: {$gt: 'post:i:4'}}]}
                ]}
                """),
            MongoFilterBuilderTest.render(MongoCursorCodec.resumeFilter(cursor, orders)));
    }

    @Test
    void nestedSortFieldsAreRead() {
        List<SortOption> orders = List.of(new SortOption("src.views", SortOrder.ASCENDING));
        Document last = new Document("_id", "post:i:1/relations:i:2")
            .append("src", new Document("views", 20L));

        String cursor = MongoCursorCodec.encode(last, orders);
        BsonDocument filter = MongoFilterBuilderTest.render(MongoCursorCodec.resumeFilter(cursor, orders));

        assertEquals(
            BsonDocument.parse("{'src.views': {$gt: {$numberLong: '20'}}}"),
            filter.getArray("$or").get(0).asDocument());
    }

    @Test
    void cursorsAreUrlSafe() {
        String cursor = MongoCursorCodec.encode(new Document("_id", "note:n:a%2Fb?c"), List.of());

        assertTrue(cursor.matches("[A-Za-z0-9_-]+"), cursor);
    }

    @Test
    void malformedCursorIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> MongoCursorCodec.resumeFilter("%%%", List.of()));
        assertThrows(IllegalArgumentException.class, () -> MongoCursorCodec.resumeFilter("bm90IGpzb24", List.of()));
    }

    @Test
    void cursorOfOtherOrdersIsRejected() {
        String cursor = MongoCursorCodec.encode(new Document("_id", "post:i:4"), List.of());

        assertThrows(IllegalArgumentException.class,
            () -> MongoCursorCodec.resumeFilter(cursor, List.of(new SortOption("views", SortOrder.ASCENDING))));
    }
}
