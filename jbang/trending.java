///usr/bin/env jbang "$0" "$@" ; exit $?
//JAVA 17
//DEPS org.springaicommunity:github-trending-cli:1.0.0-SNAPSHOT

import org.springaicommunity.github.trending.cli.GitHubTrendingCli;

public class trending {
    public static void main(String[] args) throws Exception {
        GitHubTrendingCli.main(args);
    }
}
