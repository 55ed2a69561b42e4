package conveyor.domain.slicer;

import conveyor.domain.job.CancellationToken;

import java.nio.file.Path;

/**
 * Slicing backend contract: model in, toolpath file out.
 * <p>A cancelled slice ends with {@link java.util.concurrent.CancellationException},
 * never with {@link SliceFailedException}.</p>
 */
public interface ISlicer {

    /**
     * Slice a model
     * @return path of the produced toolpath
     * @throws SliceFailedException backend failure, timeout or missing output
     * @throws InterruptedException the worker thread was interrupted, the backend is terminated
     */
    Path slice(SliceRequest request, CancellationToken token) throws SliceFailedException, InterruptedException;
}
