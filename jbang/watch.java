///usr/bin/env jbang "$0" "$@" ; exit $?
//JAVA 17
//REPOS central=https://repo1.maven.org/maven2/
//DEPS org.springaicommunity:github-watcher-cli:1.0.0-SNAPSHOT

import org.springaicommunity.github.watcher.cli.GitHubWatcherCli;

public class watch {
    public static void main(String[] args) throws Exception {
        GitHubWatcherCli.main(args);
    }
}
