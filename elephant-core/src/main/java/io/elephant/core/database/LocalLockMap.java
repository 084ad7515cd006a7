package io.elephant.core.database;

import java.util.HashSet;
import java.util.Set;

/**
 * In-process exclusive locks keyed by job id.
 */
public class LocalLockMap
{
    private static class Block
    {
        private final Set<Integer> set = new HashSet<>();

        public synchronized boolean tryLock(int key, long maxTimeoutMillis)
            throws InterruptedException
        {
            if (set.add(key)) {
                return true;
            }
            else if (maxTimeoutMillis <= 0) {
                return false;
            }
            else {
                wait(maxTimeoutMillis);
                return set.add(key);
            }
        }

        public synchronized void unlock(int key)
        {
            set.remove(key);
            notifyAll();
        }
    }

    private final Block[] blocks = new Block[256];

    public LocalLockMap()
    {
        for (int i = 0; i < blocks.length; i++) {
            blocks[i] = new Block();
        }
    }

    /**
     * Returns false without waiting if maxTimeoutMillis is 0 and the key is locked.
     */
    public boolean tryLock(int key, long maxTimeoutMillis)
        throws InterruptedException
    {
        return blockOf(key).tryLock(key, maxTimeoutMillis);
    }

    public void unlock(int key)
    {
        blockOf(key).unlock(key);
    }

    private Block blockOf(int key)
    {
        return blocks[Math.floorMod(key, blocks.length)];
    }
}
