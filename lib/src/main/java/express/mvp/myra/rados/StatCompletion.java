package express.mvp.myra.rados;

import express.mvp.myra.rados.backend.RadosBackend;
import express.mvp.myra.rados.memory.StatSlot;

/** Completion of an asynchronous stat. The backend fills the slot owned by the handle. */
final class StatCompletion extends Completion<ObjectStat> {

    StatCompletion(RadosBackend backend, CompletionHandle handle) {
        super(backend, handle);
    }

    @Override
    public CompletionKind kind() {
        return CompletionKind.STAT;
    }

    @Override
    ObjectStat harvest(int status) {
        StatSlot slot = handle().statSlot();
        return new ObjectStat(slot.size(), slot.mtimeSeconds());
    }
}
