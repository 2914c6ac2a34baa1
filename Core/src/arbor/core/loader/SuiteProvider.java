package arbor.core.loader;

/**
 * The entry point through which test code hands its suites, tests and fixtures to the loader.
 *
 * Implementations are discovered with {@link java.util.ServiceLoader}, so they must be public, have a public no-argument
 * constructor and be listed in {@code META-INF/services/arbor.core.loader.SuiteProvider}.
 */
public interface SuiteProvider {

    /**
     * Returns the name under which tests registered outside of any suite are grouped.
     *
     * @return the provider name.
     */
    public String name();

    /**
     * Registers everything this provider contributes.
     *
     * @param registry The registry to register into.
     * @throws Exception If the provider cannot build its tests. Nothing it registered is kept in that case.
     */
    public void register(TestRegistry registry) throws Exception;
}
