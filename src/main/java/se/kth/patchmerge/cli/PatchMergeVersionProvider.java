package se.kth.patchmerge.cli;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import picocli.CommandLine.IVersionProvider;

/**
 * Provides the CLI with the version of the running jar, as recorded by Maven in the jar's pom.properties.
 *
 * @author Simon Larsén
 */
public class PatchMergeVersionProvider implements IVersionProvider {
    static final String POM_PROPERTIES = "META-INF/maven/se.kth/patchmerge/pom.properties";
    static final String LOCAL_VERSION = "LOCAL";

    @Override
    public String[] getVersion() {
        return new String[] {"patchmerge " + getVersionFromPomProperties()};
    }

    private String getVersionFromPomProperties() {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(POM_PROPERTIES)) {
            if (in == null) {
                // not running from a packaged jar
                return LOCAL_VERSION;
            }
            Properties props = new Properties();
            props.load(in);
            return props.getProperty("version", LOCAL_VERSION);
        } catch (IOException e) {
            return LOCAL_VERSION;
        }
    }
}
