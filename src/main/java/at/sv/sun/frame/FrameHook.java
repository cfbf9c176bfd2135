package at.sv.sun.frame;

/**
 * Lifecycle of a script driven by the host's render loop.
 *
 * @param <T> the value produced on every frame
 */
public interface FrameHook<T> {

    /**
     * Called once before the first frame.
     */
    void init();

    /**
     * Called on every frame after {@link #init()}.
     */
    T update();
}
