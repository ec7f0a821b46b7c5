import com.mongodb.MongoException;
import io.github.flameyossnowy.skeletal.api.exceptions.SkeletalException;
import io.github.flameyossnowy.skeletal.api.exceptions.TransactionConflictException;
import io.github.flameyossnowy.skeletal.mongodb.MongoErrors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class MongoErrorsTest {
    @ParameterizedTest
    @ValueSource(ints = {112, 11000})
    void conflictCodesAreRetryable(int code) {
        MongoException cause = new MongoException(code, "conflict");

        SkeletalException translated = MongoErrors.translate(cause);

        assertInstanceOf(TransactionConflictException.class, translated);
        assertSame(cause, translated.getCause());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        MongoException.TRANSIENT_TRANSACTION_ERROR_LABEL,
        MongoException.UNKNOWN_TRANSACTION_COMMIT_RESULT_LABEL
    })
    void transactionLabelsAreRetryable(String label) {
        MongoException cause = new MongoException(91, "shutting down");
        cause.addLabel(label);

        assertInstanceOf(TransactionConflictException.class, MongoErrors.translate(cause));
    }

    @Test
    void otherFailuresAreNotConflicts() {
        MongoException cause = new MongoException(13, "unauthorized");

        SkeletalException translated = MongoErrors.translate(cause);

        assertFalse(translated instanceof TransactionConflictException);
        assertTrue(translated.getMessage().contains("unauthorized"));
    }
}
