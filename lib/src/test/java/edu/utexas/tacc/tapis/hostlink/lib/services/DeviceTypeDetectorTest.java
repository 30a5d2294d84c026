package edu.utexas.tacc.tapis.hostlink.lib.services;

import edu.utexas.tacc.tapis.hostlink.lib.exceptions.ConnectionNotFoundException;
import edu.utexas.tacc.tapis.hostlink.lib.models.RemoteCommandResult;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.io.IOException;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Test(groups = {"unit"})
public class DeviceTypeDetectorTest
{
  private static final String TARGET = "admin@edge1";

  private ConnectionLifecycleManager lifecycle;
  private DeviceTypeDetector detector;

  @BeforeMethod
  public void setUp() throws Exception
  {
    lifecycle = mock(ConnectionLifecycleManager.class);
    // Anything not stubbed below fails like a missing command
    when(lifecycle.execute(eq(TARGET), anyString()))
            .thenAnswer(inv -> new RemoteCommandResult(inv.getArgument(1), 127, "", "command not found"));
    detector = new DeviceTypeDetector(lifecycle);
  }

  private void reply(String command, String stdout) throws Exception
  {
    when(lifecycle.execute(TARGET, command)).thenReturn(new RemoteCommandResult(command, 0, stdout, ""));
  }

  @DataProvider(name = "unameOutputs")
  public Object[][] unameOutputs()
  {
    return new Object[][] {
      {"Linux edge1 5.15.0-91-generic #101-Ubuntu SMP x86_64 GNU/Linux", "linux"},
      {"FreeBSD fw 13.2-RELEASE FreeBSD 13.2-RELEASE amd64", "freebsd"},
      {"Darwin mac.local 23.1.0 Darwin Kernel Version 23.1.0", "macos"},
      {"MINGW64_NT-10.0-19045 pc 3.4.9.x86_64 2023-09-15 09:17 UTC x86_64 Msys", "windows"},
    };
  }

  @Test(dataProvider = "unameOutputs")
  public void testClassifyUname(String out, String expected)
  {
    Assert.assertEquals(DeviceTypeDetector.classifyUname(out), Optional.of(expected));
  }

  @Test
  public void testClassifyUnameNoMatch()
  {
    Assert.assertTrue(DeviceTypeDetector.classifyUname("SunOS box 5.11").isEmpty());
  }

  @Test
  public void testClassifyOsRelease()
  {
    String ubuntu = "NAME=\"Ubuntu\"\nVERSION=\"22.04.3 LTS (Jammy Jellyfish)\"\nID=ubuntu\nID_LIKE=debian\n";
    Assert.assertEquals(DeviceTypeDetector.classifyOsRelease(ubuntu), Optional.of("ubuntu"));

    String openwrt = "DISTRIB_ID='OpenWrt'\nDISTRIB_RELEASE='23.05.0'\n";
    Assert.assertEquals(DeviceTypeDetector.classifyOsRelease(openwrt), Optional.of("openwrt"));

    // ID is not a usable label so NAME is used
    String nameOnly = "ID=\"Bad Id\"\nNAME=alpine\n";
    Assert.assertEquals(DeviceTypeDetector.classifyOsRelease(nameOnly), Optional.of("alpine"));

    Assert.assertTrue(DeviceTypeDetector.classifyOsRelease("PRETTY_NAME=\"Something\"\n").isEmpty());
  }

  @Test
  public void testClassifyNetworkGear()
  {
    Assert.assertEquals(DeviceTypeDetector.classifyHostname("Cisco-core-sw1"), Optional.of("cisco"));
    Assert.assertEquals(DeviceTypeDetector.classifyHostname("huawei-agg-02"), Optional.of("huawei"));
    Assert.assertEquals(DeviceTypeDetector.classifyHostname("H3C-lab"), Optional.of("h3c"));
    Assert.assertTrue(DeviceTypeDetector.classifyHostname("web01").isEmpty());

    Assert.assertEquals(DeviceTypeDetector.classifyShowVersion("Juniper Networks, Inc. JUNOS 21.4R3"),
                        Optional.of("juniper"));
    Assert.assertEquals(DeviceTypeDetector.classifyShowVersion("Arista DCS-7050SX3-48YC8"), Optional.of("arista"));
    Assert.assertTrue(DeviceTypeDetector.classifyShowVersion("% Unknown command").isEmpty());
  }

  @Test
  public void testDetectRefinesLinuxFromOsRelease() throws Exception
  {
    reply(DeviceTypeDetector.UNAME_CMD, "Linux edge1 6.1.0-13-amd64 #1 SMP Debian x86_64 GNU/Linux\n");
    reply(DeviceTypeDetector.OS_RELEASE_CMD, "PRETTY_NAME=\"Debian GNU/Linux 12\"\nNAME=\"Debian GNU/Linux\"\nID=debian\n");
    Assert.assertEquals(detector.detect(TARGET), "debian");
  }

  @Test
  public void testDetectPlainLinux() throws Exception
  {
    reply(DeviceTypeDetector.UNAME_CMD, "Linux edge1 4.14.0 armv7l GNU/Linux\n");
    Assert.assertEquals(detector.detect(TARGET), "linux");
  }

  @Test
  public void testDetectFallsBackToHostname() throws Exception
  {
    reply(DeviceTypeDetector.HOSTNAME_CMD, "huawei-agg-02\n");
    Assert.assertEquals(detector.detect(TARGET), "huawei");
    verify(lifecycle, never()).execute(TARGET, DeviceTypeDetector.SHOW_VERSION_CMD);
  }

  @Test
  public void testDetectFromShowVersion() throws Exception
  {
    reply(DeviceTypeDetector.HOSTNAME_CMD, "core-sw1\n");
    reply(DeviceTypeDetector.SHOW_VERSION_CMD, "Cisco IOS Software, C3750E Software, Version 15.2(4)E10\n");
    Assert.assertEquals(detector.detect(TARGET), "cisco");
  }

  @Test
  public void testDetectNothingMatches() throws Exception
  {
    Assert.assertEquals(detector.detect(TARGET), "unknown");
  }

  @Test
  public void testCommandIoErrorIsNoMatch() throws Exception
  {
    when(lifecycle.execute(TARGET, DeviceTypeDetector.UNAME_CMD)).thenThrow(new IOException("broken pipe"));
    reply(DeviceTypeDetector.HOSTNAME_CMD, "H3C-lab\n");
    Assert.assertEquals(detector.detect(TARGET), "h3c");
  }

  @Test(expectedExceptions = ConnectionNotFoundException.class)
  public void testMissingConnectionPropagates() throws Exception
  {
    when(lifecycle.execute(TARGET, DeviceTypeDetector.UNAME_CMD))
            .thenThrow(new ConnectionNotFoundException("no session"));
    detector.detect(TARGET);
  }
}
