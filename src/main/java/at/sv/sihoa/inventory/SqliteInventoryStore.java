package at.sv.sihoa.inventory;

import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Device inventory in a SQLite database file. Timestamps are stored as ISO-8601 UTC text, dates as ISO-8601 text.
 */
@Slf4j
public final class SqliteInventoryStore implements InventoryStore {

    private static final int SQLITE_CONSTRAINT = 19;
    private static final String COLUMNS = "ieee_address, friendly_name, network_address, firmware_build_date, " +
                                          "firmware_version, device_type, zigbee_model, zigbee_manufacturer, " +
                                          "created_at, retired_at";

    private final String jdbcUrl;

    public SqliteInventoryStore(Path databaseFile) {
        this.jdbcUrl = "jdbc:sqlite:" + databaseFile.toAbsolutePath();
    }

    public void init() {
        try (Connection connection = openConnection(); Statement st = connection.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS device (
                        ieee_address VARCHAR(24) NOT NULL PRIMARY KEY CHECK (length(ieee_address) <= 24),
                        friendly_name VARCHAR(120) NOT NULL UNIQUE CHECK (length(friendly_name) <= 120),
                        network_address INTEGER,
                        firmware_build_date DATE,
                        firmware_version VARCHAR(60) CHECK (length(firmware_version) <= 60),
                        device_type VARCHAR(60) CHECK (length(device_type) <= 60),
                        zigbee_model VARCHAR(120) CHECK (length(zigbee_model) <= 120),
                        zigbee_manufacturer VARCHAR(120) CHECK (length(zigbee_manufacturer) <= 120),
                        created_at TEXT NOT NULL DEFAULT (strftime('%Y-%m-%dT%H:%M:%fZ', 'now')),
                        retired_at TEXT,
                        CONSTRAINT ck_device_network_address_range
                            CHECK ((network_address IS NULL) OR (network_address >= 0 AND network_address <= 65535))
                    )
                    """);
        } catch (SQLException e) {
            throw translate("Failed to initialize inventory schema", e);
        }
        log.debug("Inventory schema ready at {}", jdbcUrl);
    }

    @Override
    public <T> T inTransaction(Function<DeviceInventory, T> work) {
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            connection.setTransactionIsolation(Connection.TRANSACTION_SERIALIZABLE);
            try {
                T result = work.apply(new JdbcDeviceInventory(connection));
                connection.commit();
                return result;
            } catch (RuntimeException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw translate("Inventory transaction failed", e);
        }
    }

    private Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl);
    }

    private static RuntimeException translate(String message, SQLException e) {
        if ((e.getErrorCode() & 0xFF) == SQLITE_CONSTRAINT) {
            return new InventoryIntegrityViolation(message + ": " + e.getMessage(), e);
        }
        return new InventoryStoreFailure(message + ": " + e.getMessage(), e);
    }

    private static final class JdbcDeviceInventory implements DeviceInventory {

        private final Connection connection;

        private JdbcDeviceInventory(Connection connection) {
            this.connection = connection;
        }

        @Override
        public Optional<DeviceRecord> get(String ieeeAddress) {
            try (PreparedStatement ps = connection.prepareStatement(
                    "SELECT " + COLUMNS + " FROM device WHERE ieee_address = ?")) {
                ps.setString(1, ieeeAddress);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(map(rs)) : Optional.empty();
                }
            } catch (SQLException e) {
                throw translate("Failed to read device " + ieeeAddress, e);
            }
        }

        @Override
        public void insert(DeviceRecord device) {
            try (PreparedStatement ps = connection.prepareStatement("""
                    INSERT INTO device (ieee_address, friendly_name, network_address, firmware_build_date,
                                        firmware_version, device_type, zigbee_model, zigbee_manufacturer, retired_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """)) {
                ps.setString(1, device.getIeeeAddress());
                bindAttributes(ps, device, 2);
                ps.executeUpdate();
            } catch (SQLException e) {
                throw translate("Failed to insert device " + device.getIeeeAddress(), e);
            }
            device.setCreatedAt(readCreatedAt(device.getIeeeAddress()));
        }

        @Override
        public void update(DeviceRecord device) {
            try (PreparedStatement ps = connection.prepareStatement("""
                    UPDATE device
                       SET friendly_name = ?, network_address = ?, firmware_build_date = ?, firmware_version = ?,
                           device_type = ?, zigbee_model = ?, zigbee_manufacturer = ?, retired_at = ?
                     WHERE ieee_address = ?
                    """)) {
                bindAttributes(ps, device, 1);
                ps.setString(9, device.getIeeeAddress());
                ps.executeUpdate();
            } catch (SQLException e) {
                throw translate("Failed to update device " + device.getIeeeAddress(), e);
            }
        }

        @Override
        public List<DeviceRecord> findActive() {
            return query("SELECT " + COLUMNS + " FROM device WHERE retired_at IS NULL ORDER BY ieee_address");
        }

        @Override
        public List<DeviceRecord> findAll() {
            return query("SELECT " + COLUMNS + " FROM device ORDER BY ieee_address");
        }

        private List<DeviceRecord> query(String sql) {
            List<DeviceRecord> devices = new ArrayList<>();
            try (PreparedStatement ps = connection.prepareStatement(sql); ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    devices.add(map(rs));
                }
            } catch (SQLException e) {
                throw translate("Failed to scan devices", e);
            }
            return devices;
        }

        private Instant readCreatedAt(String ieeeAddress) {
            try (PreparedStatement ps = connection.prepareStatement(
                    "SELECT created_at FROM device WHERE ieee_address = ?")) {
                ps.setString(1, ieeeAddress);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? parseInstant(rs.getString(1)) : null;
                }
            } catch (SQLException e) {
                throw translate("Failed to read creation time of " + ieeeAddress, e);
            }
        }

        /**
         * Binds friendly name to retirement timestamp (8 parameters) starting at the given index.
         */
        private static void bindAttributes(PreparedStatement ps, DeviceRecord device, int first) throws SQLException {
            ps.setString(first, device.getFriendlyName());
            if (device.getNetworkAddress() == null) {
                ps.setNull(first + 1, Types.INTEGER);
            } else {
                ps.setInt(first + 1, device.getNetworkAddress());
            }
            ps.setString(first + 2, device.getFirmwareBuildDate() == null ? null : device.getFirmwareBuildDate().toString());
            ps.setString(first + 3, device.getFirmwareVersion());
            ps.setString(first + 4, device.getDeviceType());
            ps.setString(first + 5, device.getModel());
            ps.setString(first + 6, device.getManufacturer());
            ps.setString(first + 7, device.getRetiredAt() == null ? null : device.getRetiredAt().toString());
        }

        private static DeviceRecord map(ResultSet rs) throws SQLException {
            int networkAddress = rs.getInt("network_address");
            boolean noNetworkAddress = rs.wasNull();
            String buildDate = rs.getString("firmware_build_date");
            return DeviceRecord.builder()
                               .ieeeAddress(rs.getString("ieee_address"))
                               .friendlyName(rs.getString("friendly_name"))
                               .networkAddress(noNetworkAddress ? null : networkAddress)
                               .firmwareBuildDate(buildDate == null ? null : LocalDate.parse(buildDate))
                               .firmwareVersion(rs.getString("firmware_version"))
                               .deviceType(rs.getString("device_type"))
                               .model(rs.getString("zigbee_model"))
                               .manufacturer(rs.getString("zigbee_manufacturer"))
                               .createdAt(parseInstant(rs.getString("created_at")))
                               .retiredAt(parseInstant(rs.getString("retired_at")))
                               .build();
        }

        private static Instant parseInstant(String value) {
            return value == null ? null : Instant.parse(value);
        }
    }
}
