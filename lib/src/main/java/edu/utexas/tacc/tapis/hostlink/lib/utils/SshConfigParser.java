package edu.utexas.tacc.tapis.hostlink.lib.utils;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

/*
 * Minimal reader for the Host, HostName, User and Port keywords of an ssh client configuration file.
 *
 * Keywords are case insensitive and may be separated from their value by blanks or '='. Comment and blank
 * lines are skipped, as is every other keyword. Host patterns containing '*' or '?' are skipped together with
 * their block, and only the first pattern of a Host line is used.
 */
public final class SshConfigParser
{
  private SshConfigParser() { throw new AssertionError(); }

  /*
   * Values from one Host block. Fields not given in the file are null, port is 0.
   */
  public static final class HostBlock
  {
    private final String alias;
    private String hostName;
    private String user;
    private int port;

    HostBlock(String alias1) { alias = alias1; }

    public String getAlias() { return alias; }
    public String getHostName() { return hostName; }
    public String getUser() { return user; }
    public int getPort() { return port; }
  }

  /**
   * @param lines content of the configuration file
   * @return host blocks in file order
   */
  public static List<HostBlock> parse(List<String> lines)
  {
    List<HostBlock> blocks = new ArrayList<>();
    HostBlock current = null;
    for (String rawLine : lines)
    {
      String line = rawLine.trim();
      if (line.isEmpty() || line.startsWith("#")) continue;

      String keyword = StringUtils.substringBefore(line.replace('=', ' ').replace('\t', ' '), " ");
      String value = StringUtils.strip(line.substring(keyword.length()), " \t=");
      if ("Host".equalsIgnoreCase(keyword))
      {
        String[] patterns = StringUtils.split(value);
        String alias = patterns.length == 0 ? null : patterns[0];
        current = (alias == null || StringUtils.containsAny(alias, '*', '?')) ? null : new HostBlock(alias);
        if (current != null) blocks.add(current);
        continue;
      }
      if (current == null || value.isEmpty()) continue;

      if ("HostName".equalsIgnoreCase(keyword)) current.hostName = value;
      else if ("User".equalsIgnoreCase(keyword)) current.user = value;
      else if ("Port".equalsIgnoreCase(keyword)) current.port = NumberUtils.toInt(value, 0);
    }
    return blocks;
  }
}
