package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.ParsedSystemInfo;
import com.stealerlens.normalization.country.CountryCodeNormalizer;
import com.stealerlens.normalization.country.IsoCountryCodeNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * One representative log per family, trimmed to the lines each parser reads.
 */
@DisplayName("Family Parser Tests")
class FamilyParsersTest {

    private static final CountryCodeNormalizer COUNTRIES = new IsoCountryCodeNormalizer();

    private static String log(String... lines) {
        return String.join("\n", lines);
    }

    @Nested
    @DisplayName("Astris")
    class Astris {

        @Test
        @DisplayName("Should read fields from their INI sections")
        void shouldParseSections() {
            ParsedSystemInfo info = new AstrisParser(COUNTRIES).parse(log(
                "[General]",
                "Build: recaptcha-verify",
                "HWID: H1",
                "Date: 2025-01-02 10:00:00",
                "[Machine]",
                "Computer Name: PC1",
                "User Name: PC1\\bob",
                "System: Windows 11",
                "Antiviruses: Windows Defender",
                "[Geolocation]",
                "Country: Germany",
                "[Network]",
                "Public IP Address: 8.8.8.8",
                "Private IP Address: 192.168.0.3",
                "[Hardware]",
                "CPU: AMD Ryzen 5 5600X",
                "GPU: NVIDIA GeForce RTX 3060",
                "RAM: 32 GB"), "Information.txt");

            assertThat(info.getStealerType()).isEqualTo("Astris");
            assertThat(info.getHwid()).isEqualTo("H1");
            assertThat(info.getLogDate()).isEqualTo("2025-01-02 10:00:00");
            assertThat(info.getComputerName()).isEqualTo("PC1");
            assertThat(info.getUsername()).isEqualTo("bob");
            assertThat(info.getOs()).isEqualTo("Windows 11");
            assertThat(info.getAntivirus()).isEqualTo("Windows Defender");
            assertThat(info.getCountry()).isEqualTo("DE");
            assertThat(info.getIpAddress()).isEqualTo("8.8.8.8");
            assertThat(info.getCpu()).isEqualTo("AMD Ryzen 5 5600X");
            assertThat(info.getGpu()).isEqualTo("NVIDIA GeForce RTX 3060");
            assertThat(info.getRam()).isEqualTo("32 GB");
        }
    }

    @Nested
    @DisplayName("Atomic Mac")
    class AtomicMac {

        @Test
        @DisplayName("Should combine product name, version and build into the OS")
        void shouldParseSystemProfilerDump() {
            ParsedSystemInfo info = new AtomicMacParser(COUNTRIES).parse(log(
                "ProductName:\t\tmacOS",
                "ProductVersion:\t\t14.1",
                "BuildVersion:\t\t23B74",
                "IP: 8.8.4.4",
                "Country: United States",
                "Hardware Overview:",
                "      Model Name: MacBook Pro",
                "      Chip: Apple M1",
                "      Memory: 16 GB",
                "      Serial Number (system): C02XYZ",
                "Graphics/Displays:",
                "    Apple M1:",
                "      Chipset Model: Apple M1"), "system_info.txt");

            assertThat(info.getOs()).isEqualTo("macOS 14.1 (23B74)");
            assertThat(info.getIpAddress()).isEqualTo("8.8.4.4");
            assertThat(info.getCountry()).isEqualTo("US");
            assertThat(info.getComputerName()).isEqualTo("MacBook Pro");
            assertThat(info.getCpu()).isEqualTo("Apple M1");
            assertThat(info.getRam()).isEqualTo("16 GB");
            assertThat(info.getHwid()).isEqualTo("C02XYZ");
            assertThat(info.getGpu()).isEqualTo("Apple M1");
        }
    }

    @Nested
    @DisplayName("Banshee")
    class Banshee {

        @Test
        @DisplayName("Should strip the login name and CPU clock")
        void shouldParse() {
            ParsedSystemInfo info = new BansheeParser(COUNTRIES).parse(log(
                "HWID: 1111-2222",
                "Log date: 2024-10-10 12:00:00",
                "Build name: x",
                "Country code: FR",
                "User name: John Smith (johnsmith)",
                "Computer name: Johns-MacBook",
                "Operation system: macOS 14.2",
                "CPU: Intel Core i5, 2.40 GHz",
                "RAM: 8 GB",
                "IP: 9.8.7.6"), "System.txt");

            assertThat(info.getHwid()).isEqualTo("1111-2222");
            assertThat(info.getLogDate()).isEqualTo("2024-10-10 12:00:00");
            assertThat(info.getCountry()).isEqualTo("FR");
            assertThat(info.getUsername()).isEqualTo("John Smith");
            assertThat(info.getComputerName()).isEqualTo("Johns-MacBook");
            assertThat(info.getOs()).isEqualTo("macOS 14.2");
            assertThat(info.getCpu()).isEqualTo("Intel Core i5");
            assertThat(info.getRam()).isEqualTo("8 GB");
            assertThat(info.getIpAddress()).isEqualTo("9.8.7.6");
        }
    }

    @Nested
    @DisplayName("CryptBot")
    class CryptBot {

        @Test
        @DisplayName("Should split the combined user and computer line")
        void shouldParse() {
            ParsedSystemInfo info = new CryptBotParser().parse(log(
                "OS: Windows 10 Pro",
                "Local Date and Time: 2024-01-01 10:00:00",
                "UserName (ComputerName): Bruno (DESKTOP-ET51AJO)",
                "CPU: Intel Core i7 [8 cores]",
                "RAM: 16 GB",
                "GPU: Intel HD"), "_Information.txt");

            assertThat(info.getOs()).isEqualTo("Windows 10 Pro");
            assertThat(info.getLogDate()).isEqualTo("2024-01-01 10:00:00");
            assertThat(info.getUsername()).isEqualTo("Bruno");
            assertThat(info.getComputerName()).isEqualTo("DESKTOP-ET51AJO");
            assertThat(info.getCpu()).isEqualTo("Intel Core i7");
            assertThat(info.getRam()).isEqualTo("16 GB");
            assertThat(info.getGpu()).isEqualTo("Intel HD");
        }

        @Test
        @DisplayName("Should keep the whole value as username when no computer name is given")
        void shouldHandleMissingComputerName() {
            ParsedSystemInfo info = new CryptBotParser().parse("UserName (ComputerName): Bruno", "_Information.txt");

            assertThat(info.getUsername()).isEqualTo("Bruno");
            assertThat(info.getComputerName()).isNull();
        }
    }

    @Nested
    @DisplayName("DarkCrystal RAT")
    class DarkCrystalRat {

        @Test
        @DisplayName("Should read the leading country code and skip unknown hardware")
        void shouldParse() {
            ParsedSystemInfo info = new DarkCrystalRatParser(COUNTRIES).parse(log(
                "PC Name: SRV01",
                "User Name: SRV01\\admin",
                "Windows: Windows Server 2019",
                "CPU Name: Unknown",
                "GPU Name: Microsoft Basic Display Adapter",
                "RAM: 4096 MB",
                "IP: 10.0.0.5",
                "Country: US / United States",
                "Save Time: 2024-02-03 04:05:06",
                "Path: C:\\temp\\x.exe"), "Info.txt");

            assertThat(info.getComputerName()).isEqualTo("SRV01");
            assertThat(info.getUsername()).isEqualTo("admin");
            assertThat(info.getOs()).isEqualTo("Windows Server 2019");
            assertThat(info.getCpu()).isNull();
            assertThat(info.getGpu()).isEqualTo("Microsoft Basic Display Adapter");
            assertThat(info.getRam()).isEqualTo("4096 MB");
            assertThat(info.getIpAddress()).isEqualTo("10.0.0.5");
            assertThat(info.getCountry()).isEqualTo("US");
            assertThat(info.getLogDate()).isEqualTo("2024-02-03 04:05:06");
            assertThat(info.getFilePath()).isEqualTo("C:\\temp\\x.exe");
        }
    }

    @Nested
    @DisplayName("Meduza")
    class Meduza {

        @Test
        @DisplayName("Should strip the core count from the CPU")
        void shouldParse() {
            ParsedSystemInfo info = new MeduzaParser(COUNTRIES).parse(log(
                "Build name: m",
                "HWID: ABC",
                "Log date: 5/6/2024 1:02:03 PM",
                "Country code: CA",
                "User name: alice",
                "Computer name: ALICE-PC",
                "Operation system: Windows 10 Home",
                "CPU: AMD Ryzen 7, 8 cores",
                "GPU: AMD Radeon",
                "RAM: 16 GB",
                "IP: 1.1.1.1",
                "Execute path: C:\\a.exe"), "UserInfo.txt");

            assertThat(info.getHwid()).isEqualTo("ABC");
            assertThat(info.getLogDate()).isEqualTo("5/6/2024 1:02:03 PM");
            assertThat(info.getCountry()).isEqualTo("CA");
            assertThat(info.getUsername()).isEqualTo("alice");
            assertThat(info.getComputerName()).isEqualTo("ALICE-PC");
            assertThat(info.getOs()).isEqualTo("Windows 10 Home");
            assertThat(info.getCpu()).isEqualTo("AMD Ryzen 7");
            assertThat(info.getGpu()).isEqualTo("AMD Radeon");
            assertThat(info.getIpAddress()).isEqualTo("1.1.1.1");
            assertThat(info.getFilePath()).isEqualTo("C:\\a.exe");
        }
    }

    @Nested
    @DisplayName("Noxty")
    class Noxty {

        @Test
        @DisplayName("Should strip the CPU clock and GPU memory")
        void shouldParse() {
            ParsedSystemInfo info = new NoxtyParser(COUNTRIES).parse(log(
                "User: DESKTOP\\carol",
                "Operating System: Windows 11 Pro",
                "Process Executable Path: C:\\n.exe",
                "CPU: Intel Core i5-1135G7 2.40 GHz",
                "RAM: 8 GB",
                "GPU: Intel Iris Xe (1024 MB)",
                "Serial Number: SN-1",
                "IP: 2.2.2.2",
                "Country: Poland"), "Identification.txt");

            assertThat(info.getUsername()).isEqualTo("carol");
            assertThat(info.getOs()).isEqualTo("Windows 11 Pro");
            assertThat(info.getFilePath()).isEqualTo("C:\\n.exe");
            assertThat(info.getCpu()).isEqualTo("Intel Core i5-1135G7");
            assertThat(info.getGpu()).isEqualTo("Intel Iris Xe");
            assertThat(info.getHwid()).isEqualTo("SN-1");
            assertThat(info.getCountry()).isEqualTo("PL");
        }
    }

    @Nested
    @DisplayName("Phemedrone")
    class Phemedrone {

        @Test
        @DisplayName("Should read fields from their banner sections")
        void shouldParse() {
            ParsedSystemInfo info = new PhemedroneParser(COUNTRIES).parse(log(
                "----- Geolocation Data -----",
                "IP: 3.3.3.3",
                "Country: Brazil (BR)",
                "----- Hardware Info -----",
                "Username: dave",
                "Windows name: Windows 10 Enterprise",
                "Hardware ID: HW-9",
                "GPU: GTX 1650",
                "CPU: i5-9400F",
                "RAM: 16 GB",
                "----- Miscellaneous -----",
                "Antivirus products: Windows Defender",
                "File Location: C:\\p.exe"), "Information.txt");

            assertThat(info.getIpAddress()).isEqualTo("3.3.3.3");
            assertThat(info.getCountry()).isEqualTo("BR");
            assertThat(info.getUsername()).isEqualTo("dave");
            assertThat(info.getOs()).isEqualTo("Windows 10 Enterprise");
            assertThat(info.getHwid()).isEqualTo("HW-9");
            assertThat(info.getGpu()).isEqualTo("GTX 1650");
            assertThat(info.getCpu()).isEqualTo("i5-9400F");
            assertThat(info.getRam()).isEqualTo("16 GB");
            assertThat(info.getAntivirus()).isEqualTo("Windows Defender");
            assertThat(info.getFilePath()).isEqualTo("C:\\p.exe");
        }

        @Test
        @DisplayName("Should ignore hardware labels outside the hardware section")
        void shouldIgnoreOutOfSectionLabels() {
            ParsedSystemInfo info = new PhemedroneParser(COUNTRIES).parse("CPU: i7\n----- Hardware Info -----\nRAM: 8 GB", "Information.txt");

            assertThat(info.getCpu()).isNull();
            assertThat(info.getRam()).isEqualTo("8 GB");
        }
    }

    @Nested
    @DisplayName("PredatorTheThief")
    class PredatorTheThief {

        @Test
        @DisplayName("Should drop the free RAM annotation")
        void shouldParse() {
            ParsedSystemInfo info = new PredatorTheThiefParser().parse(log(
                "Predator The Thief",
                "User name: eve",
                "Machine name: EVE-PC",
                "OS Version: Windows 7",
                "Launch time: 2019-03-04 05:06:07",
                "CPU info: Intel Pentium",
                "Amount of RAM: 8192 MB (6144 MB free)",
                "GPU info: Intel HD 3000",
                "Startup folder: C:\\Users\\eve\\AppData"), "Information.txt");

            assertThat(info.getUsername()).isEqualTo("eve");
            assertThat(info.getComputerName()).isEqualTo("EVE-PC");
            assertThat(info.getOs()).isEqualTo("Windows 7");
            assertThat(info.getLogDate()).isEqualTo("2019-03-04 05:06:07");
            assertThat(info.getCpu()).isEqualTo("Intel Pentium");
            assertThat(info.getRam()).isEqualTo("8192 MB");
            assertThat(info.getGpu()).isEqualTo("Intel HD 3000");
            assertThat(info.getFilePath()).isEqualTo("C:\\Users\\eve\\AppData");
        }
    }

    @Nested
    @DisplayName("Raccoon")
    class Raccoon {

        @Test
        @DisplayName("Should read the system block, country from location and the first display device")
        void shouldParse() {
            ParsedSystemInfo info = new RaccoonParser(COUNTRIES).parse(log(
                "System Information:",
                "- IP: 4.4.4.4",
                "- Location: 52.27, 21.08 | Warsaw, Mazovia, Poland (03-890)",
                "- ComputerName: RAC-PC",
                "- Username: frank",
                "- OS: Windows 10 Pro",
                "- CPU: Intel Core i3 (4 cores)",
                "- RAM: 4096 MB (2048 MB free)",
                "- Display devices:",
                "\t0) Intel(R) HD Graphics 5500",
                "\t1) NVIDIA GeForce 920M"), "System Info.txt");

            assertThat(info.getIpAddress()).isEqualTo("4.4.4.4");
            assertThat(info.getCountry()).isEqualTo("PL");
            assertThat(info.getComputerName()).isEqualTo("RAC-PC");
            assertThat(info.getUsername()).isEqualTo("frank");
            assertThat(info.getOs()).isEqualTo("Windows 10 Pro");
            assertThat(info.getCpu()).isEqualTo("Intel Core i3");
            assertThat(info.getRam()).isEqualTo("4096 MB");
            assertThat(info.getGpu()).isEqualTo("Intel(R) HD Graphics 5500");
        }

        @Test
        @DisplayName("Should read the IP from an IP info line outside the system block")
        void shouldReadIpInfo() {
            ParsedSystemInfo info = new RaccoonParser(COUNTRIES).parse("IP info: PL 31.60.52.174", "System Info.txt");

            assertThat(info.getIpAddress()).isEqualTo("31.60.52.174");
        }
    }

    @Nested
    @DisplayName("Rhadamanthys")
    class Rhadamanthys {

        @Test
        @DisplayName("Should fall back to the machine id when the HWID is redacted")
        void shouldParse() {
            ParsedSystemInfo info = new RhadamanthysParser(COUNTRIES).parse(log(
                "Traffic Name: t1",
                "Install Date: 19/07/2025 17:14:05 (sig:abc)",
                "HWID: [redacted]",
                "MachineID: M-1",
                "IP: 5.5.5.5",
                "Country: Germany",
                "Processor: Intel Xeon",
                "Installed RAM: 32 GB",
                "OS: Windows Server 2022",
                "Video Card: Matrox G200",
                "Computer Name: SRV",
                "User Name: svc"), "UserInfo.txt");

            assertThat(info.getLogDate()).isEqualTo("19/07/2025 17:14:05");
            assertThat(info.getHwid()).isEqualTo("M-1");
            assertThat(info.getIpAddress()).isEqualTo("5.5.5.5");
            assertThat(info.getCountry()).isEqualTo("DE");
            assertThat(info.getCpu()).isEqualTo("Intel Xeon");
            assertThat(info.getRam()).isEqualTo("32 GB");
            assertThat(info.getOs()).isEqualTo("Windows Server 2022");
            assertThat(info.getGpu()).isEqualTo("Matrox G200");
            assertThat(info.getComputerName()).isEqualTo("SRV");
            assertThat(info.getUsername()).isEqualTo("svc");
        }
    }

    @Nested
    @DisplayName("RisePro")
    class RisePro {

        @Test
        @DisplayName("Should strip the workgroup and video card index")
        void shouldParse() {
            ParsedSystemInfo info = new RiseProParser(COUNTRIES).parse(log(
                "Build: 1",
                "Date: 2024-04-04 04:04:04",
                "MachineID: R-1",
                "Path: C:\\r.exe",
                "IP: 6.6.6.6",
                "Location: NL, Amsterdam",
                "Windows: Windows 10 Pro",
                "Computer Name: DESKTOP-1 [WORKGROUP]",
                "User Name: gina",
                "[Hardware]",
                "Processor: Intel Core i9",
                "RAM: 65536 MB",
                "VideoCard: #1: NVIDIA GeForce GTX 1060"), "Information.txt");

            assertThat(info.getLogDate()).isEqualTo("2024-04-04 04:04:04");
            assertThat(info.getHwid()).isEqualTo("R-1");
            assertThat(info.getFilePath()).isEqualTo("C:\\r.exe");
            assertThat(info.getIpAddress()).isEqualTo("6.6.6.6");
            assertThat(info.getCountry()).isEqualTo("NL");
            assertThat(info.getOs()).isEqualTo("Windows 10 Pro");
            assertThat(info.getComputerName()).isEqualTo("DESKTOP-1");
            assertThat(info.getUsername()).isEqualTo("gina");
            assertThat(info.getCpu()).isEqualTo("Intel Core i9");
            assertThat(info.getRam()).isEqualTo("65536 MB");
            assertThat(info.getGpu()).isEqualTo("NVIDIA GeForce GTX 1060");
        }

        @Test
        @DisplayName("Should skip a location without a leading country code")
        void shouldSkipLocationWithoutCode() {
            ParsedSystemInfo info = new RiseProParser(COUNTRIES).parse("Location: somewhere", "Information.txt");

            assertThat(info.getCountry()).isNull();
        }
    }

    @Nested
    @DisplayName("RL Stealer")
    class RlStealer {

        @Test
        @DisplayName("Should read space-padded labels")
        void shouldParse() {
            ParsedSystemInfo info = new RlStealerParser().parse(log(
                "Operating system : Windows 10",
                "PC user : DESKTOP-ABC / John",
                "Launch : C:\\rl.exe",
                "Current time : 2024-07-07 07:07:07",
                "HWID : RL-1",
                "CPU : Intel i7",
                "RAM : 16 GB",
                "GPU : RTX 2070",
                "IP Geolocation : 127.0.0.1 [India]"), "System.txt");

            assertThat(info.getOs()).isEqualTo("Windows 10");
            assertThat(info.getUsername()).isEqualTo("John");
            assertThat(info.getFilePath()).isEqualTo("C:\\rl.exe");
            assertThat(info.getLogDate()).isEqualTo("2024-07-07 07:07:07");
            assertThat(info.getHwid()).isEqualTo("RL-1");
            assertThat(info.getCpu()).isEqualTo("Intel i7");
            assertThat(info.getRam()).isEqualTo("16 GB");
            assertThat(info.getGpu()).isEqualTo("RTX 2070");
            assertThat(info.getIpAddress()).isEqualTo("127.0.0.1");
        }
    }

    @Nested
    @DisplayName("Skalka")
    class Skalka {

        @Test
        @DisplayName("Should expand the OS short name and read the locale country")
        void shouldParse() {
            ParsedSystemInfo info = new SkalkaParser(COUNTRIES).parse(log(
                "Operation system: win10",
                "Current jarfile path: /home/u/s.jar",
                "Username: henry",
                "IP: 7.7.7.7",
                "Timezone: 2024-05-01T10:00:00.123+02:00[Europe/Berlin]",
                "Language & country: en_US"), "Info.txt");

            assertThat(info.getOs()).isEqualTo("Windows 10");
            assertThat(info.getFilePath()).isEqualTo("\\home\\u\\s.jar");
            assertThat(info.getUsername()).isEqualTo("henry");
            assertThat(info.getIpAddress()).isEqualTo("7.7.7.7");
            assertThat(info.getLogDate()).isEqualTo("2024-05-01T10:00:00.123");
            assertThat(info.getCountry()).isEqualTo("US");
        }
    }

    @Nested
    @DisplayName("StealC")
    class StealC {

        @Test
        @DisplayName("Should read network and system blocks with a nested GPU list")
        void shouldParse() {
            ParsedSystemInfo info = new StealCParser(COUNTRIES).parse(log(
                "Network Info:",
                "\t- IP: 122.161.1.1",
                "\t- Country: IN",
                "",
                "System Summary:",
                "\t- HWID: S-1",
                "\t- OS: Windows 10 Pro",
                "\t- Username: ivan",
                "\t- Computer Name: IVAN-PC",
                "\t- Local Time: 2024/6/22 15:49:7",
                "\t- Running Path: C:\\s.exe",
                "\t- CPU: Intel Core i5",
                "\t- GPU:",
                "\t\t-Intel(R) HD Graphics 5500",
                "\t\t-NVIDIA GeForce 940M",
                "\t- RAM: 3971 MB"), "System.txt");

            assertThat(info.getIpAddress()).isEqualTo("122.161.1.1");
            assertThat(info.getCountry()).isEqualTo("IN");
            assertThat(info.getHwid()).isEqualTo("S-1");
            assertThat(info.getOs()).isEqualTo("Windows 10 Pro");
            assertThat(info.getUsername()).isEqualTo("ivan");
            assertThat(info.getComputerName()).isEqualTo("IVAN-PC");
            assertThat(info.getLogDate()).isEqualTo("2024/6/22 15:49:7");
            assertThat(info.getFilePath()).isEqualTo("C:\\s.exe");
            assertThat(info.getCpu()).isEqualTo("Intel Core i5");
            assertThat(info.getGpu()).isEqualTo("Intel(R) HD Graphics 5500");
            assertThat(info.getRam()).isEqualTo("3971 MB");
        }
    }

    @Nested
    @DisplayName("Stealerium")
    class Stealerium {

        @Test
        @DisplayName("Should prefer the external IP")
        void shouldParse() {
            ParsedSystemInfo info = new StealeriumParser().parse(log(
                "[IP]",
                "External IP: 8.8.8.8",
                "Internal IP: 192.168.0.2",
                "[Machine]",
                "Username: jack",
                "Compname: JACK-PC",
                "System: Windows 10",
                "CPU: Intel i5",
                "GPU: Intel UHD",
                "RAM: 8 GB",
                "Date: 2024-08-08 08:08:08",
                "[Virtualization]",
                "Antivirus: Defender"), "SystemInfo.txt");

            assertThat(info.getIpAddress()).isEqualTo("8.8.8.8");
            assertThat(info.getUsername()).isEqualTo("jack");
            assertThat(info.getComputerName()).isEqualTo("JACK-PC");
            assertThat(info.getOs()).isEqualTo("Windows 10");
            assertThat(info.getCpu()).isEqualTo("Intel i5");
            assertThat(info.getGpu()).isEqualTo("Intel UHD");
            assertThat(info.getRam()).isEqualTo("8 GB");
            assertThat(info.getLogDate()).isEqualTo("2024-08-08 08:08:08");
            assertThat(info.getAntivirus()).isEqualTo("Defender");
        }
    }

    @Nested
    @DisplayName("Vidar")
    class Vidar {

        @Test
        @DisplayName("Should skip redacted values and read hardware from its section")
        void shouldParse() {
            ParsedSystemInfo info = new VidarParser(COUNTRIES).parse(log(
                "Version: 12",
                "Date: Sat Jul 06 3:43:57 2024",
                "MachineID: V-1",
                "Path: C:\\v.exe",
                "IP: [redacted]",
                "Country: Spain",
                "Windows: Windows 10 Pro",
                "Computer Name: VID-PC",
                "User Name: kate",
                "[Hardware]",
                "Processor: Intel i7",
                "RAM: 16 GB",
                "Videocard: NVIDIA RTX"), "Information.txt");

            assertThat(info.getLogDate()).isEqualTo("Sat Jul 06 3:43:57 2024");
            assertThat(info.getHwid()).isEqualTo("V-1");
            assertThat(info.getFilePath()).isEqualTo("C:\\v.exe");
            assertThat(info.getIpAddress()).isNull();
            assertThat(info.getCountry()).isEqualTo("ES");
            assertThat(info.getOs()).isEqualTo("Windows 10 Pro");
            assertThat(info.getComputerName()).isEqualTo("VID-PC");
            assertThat(info.getUsername()).isEqualTo("kate");
            assertThat(info.getCpu()).isEqualTo("Intel i7");
            assertThat(info.getRam()).isEqualTo("16 GB");
            assertThat(info.getGpu()).isEqualTo("NVIDIA RTX");
        }
    }

    @Nested
    @DisplayName("XFiles")
    class XFiles {

        @Test
        @DisplayName("Should read bracketed hardware labels")
        void shouldParse() {
            ParsedSystemInfo info = new XFilesParser(COUNTRIES).parse(log(
                "Operation ID: x",
                "IP: 9.9.9.9",
                "Country: Italy",
                "Operating System: Windows 10",
                "Username: leo",
                "Computer Name: LEO-PC",
                "Hardware ID: XF-1",
                "CPU (Processor): Intel i3",
                "GPU (Display devices): Intel HD",
                "RAM (Memory): 8 GB"), "Information.txt");

            assertThat(info.getIpAddress()).isEqualTo("9.9.9.9");
            assertThat(info.getCountry()).isEqualTo("IT");
            assertThat(info.getOs()).isEqualTo("Windows 10");
            assertThat(info.getUsername()).isEqualTo("leo");
            assertThat(info.getComputerName()).isEqualTo("LEO-PC");
            assertThat(info.getHwid()).isEqualTo("XF-1");
            assertThat(info.getCpu()).isEqualTo("Intel i3");
            assertThat(info.getGpu()).isEqualTo("Intel HD");
            assertThat(info.getRam()).isEqualTo("8 GB");
        }
    }

    @Nested
    @DisplayName("Ailurophile")
    class Ailurophile {

        @Test
        @DisplayName("Should skip redacted lines")
        void shouldParse() {
            ParsedSystemInfo info = new AilurophileParser(COUNTRIES).parse(log(
                "IP: 10.1.1.1",
                "Country: [redacted]",
                "Hostname: AIL-PC",
                "PC Type: Microsoft Windows 10 Pro",
                "File Path: C:\\ail.exe"), "System.txt");

            assertThat(info.getIpAddress()).isEqualTo("10.1.1.1");
            assertThat(info.getCountry()).isNull();
            assertThat(info.getComputerName()).isEqualTo("AIL-PC");
            assertThat(info.getOs()).isEqualTo("Microsoft Windows 10 Pro");
            assertThat(info.getFilePath()).isEqualTo("C:\\ail.exe");
        }
    }
}
