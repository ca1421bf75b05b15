package express.mvp.myra.rados;

import java.time.Instant;

/**
 * Size and modification time of an object.
 *
 * @param size object size in bytes
 * @param mtimeSeconds modification time in seconds since the epoch
 */
public record ObjectStat(long size, long mtimeSeconds) {

    /**
     * Returns the modification time.
     *
     * @return the modification instant
     */
    public Instant modificationTime() {
        return Instant.ofEpochSecond(mtimeSeconds);
    }
}
