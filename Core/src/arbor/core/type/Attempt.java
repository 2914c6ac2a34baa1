package arbor.core.type;

/**
 * The outcome of an operation that is allowed to fail without throwing: either some data or an error message.
 *
 * @param <D> The type of the data produced on success.
 */
public final class Attempt<D> {
    private final boolean success;
    private final D data;
    private final String error;

    private Attempt(boolean success, D data, String error) {
        this.success = success;
        this.data = data;
        this.error = error;
    }

    public static <D> Attempt<D> successful(D data) {
        return new Attempt<>(true, data, null);
    }

    public static <D> Attempt<D> error(String error) {
        return new Attempt<>(false, null, error);
    }

    public boolean isSuccess() {
        return this.success;
    }

    public D getData() {
        return this.data;
    }

    public String getError() {
        return this.error;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { " + (this.success ? "success: " + this.data : "error: " + this.error) + " }";
    }
}
