package work.strata.engine.cli;

import picocli.CommandLine;
import work.strata.engine.commands.DefaultContext;

/**
 * {@code strata --version}: the jar's implementation version plus the size of the builtin command set.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    static final String DEVELOPMENT = "development";

    @Override
    public String[] getVersion() {
        String version = StrataCommand.class.getPackage().getImplementationVersion();
        int builtins = DefaultContext.create().numDecls();
        return new String[] {
            "strata " + (version == null ? DEVELOPMENT : version),
            builtins + " builtin commands, java " + Runtime.version().feature()
        };
    }
}
