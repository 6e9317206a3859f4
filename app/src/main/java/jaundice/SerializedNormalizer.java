package jaundice;

import java.util.concurrent.locks.ReentrantLock;

// Lets workers share a normalizer that is not safe for concurrent use.
public class SerializedNormalizer implements WordNormalizer {

    private final WordNormalizer delegate;
    private final ReentrantLock lock = new ReentrantLock();

    public SerializedNormalizer(WordNormalizer delegate) {
        this.delegate = delegate;
    }

    // Wrap only when needed.
    public static WordNormalizer guard(WordNormalizer normalizer) {
        return normalizer.isThreadSafe() ? normalizer : new SerializedNormalizer(normalizer);
    }

    @Override
    public String normalize(String word) {
        lock.lock();
        try {
            return delegate.normalize(word);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isThreadSafe() {
        return true;
    }
}
