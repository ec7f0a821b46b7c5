import io.github.flameyossnowy.skeletal.api.exceptions.LockedException;
import io.github.flameyossnowy.skeletal.api.exceptions.SkeletalException;
import io.github.flameyossnowy.skeletal.api.result.TransactionResult;
import io.github.flameyossnowy.skeletal.api.store.Key;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TransactionResultTest {

    @Test
    void success_mapsValue() {
        TransactionResult<Integer> result = TransactionResult.success(2).map(value -> value * 21);
        assertTrue(result.isSuccess());
        assertEquals(42, result.orElseThrow());
        assertEquals(42, result.expect("unused"));
    }

    @Test
    void failure_carriesError() {
        LockedException locked = new LockedException(Key.of("user", 1), List.of(Key.of("post", 2)));
        TransactionResult<Integer> result = TransactionResult.<Integer>failure(locked).map(value -> value + 1);

        assertTrue(result.isError());
        assertTrue(result.isErrorOf(SkeletalException.class));
        assertEquals(7, result.orElse(7));
        assertSame(locked, assertThrows(LockedException.class, result::orElseThrow));
    }
}
