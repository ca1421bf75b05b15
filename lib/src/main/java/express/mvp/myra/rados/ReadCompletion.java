package express.mvp.myra.rados;

import express.mvp.myra.rados.backend.RadosBackend;

/**
 * Completion of an asynchronous read. The buffer was allocated before submission and is released
 * with the token.
 */
final class ReadCompletion extends Completion<byte[]> {

    ReadCompletion(RadosBackend backend, CompletionHandle handle) {
        super(backend, handle);
    }

    @Override
    public CompletionKind kind() {
        return CompletionKind.READ;
    }

    @Override
    byte[] harvest(int status) {
        return handle().buffer().toByteArray(status);
    }
}
