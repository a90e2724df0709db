package tech.databroker.platform.weather;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import tech.databroker.core.GuidIdentity;

import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * JPA entity for weather_forecasts table.
 *
 * <p>Instances handed out by the data broker are detached copies. Equality is by value
 * over all fields, which the edit context relies on for dirty tracking.
 */
@Entity
@Table(name = "weather_forecasts")
public class WeatherForecast implements GuidIdentity {

    @Id
    @Column(name = "uid", nullable = false)
    public UUID uid = EMPTY_UID;

    @Column(name = "forecast_date", nullable = false)
    public LocalDate date = LocalDate.now();

    @Column(name = "temperature_c", nullable = false)
    public int temperatureC = 60;

    @Column(name = "summary", length = 64)
    public String summary = "Testing";

    public WeatherForecast() {
    }

    public WeatherForecast(UUID uid, LocalDate date, int temperatureC, String summary) {
        this.uid = uid;
        this.date = date;
        this.temperatureC = temperatureC;
        this.summary = summary;
    }

    @Override
    public UUID uid() {
        return uid;
    }

    public int temperatureF() {
        return 32 + (int) (temperatureC / 0.5556);
    }

    public WeatherForecast copy() {
        return new WeatherForecast(uid, date, temperatureC, summary);
    }

    public WeatherForecast withSummary(String summary) {
        WeatherForecast copy = copy();
        copy.summary = summary;
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WeatherForecast other)) {
            return false;
        }
        return temperatureC == other.temperatureC
            && Objects.equals(uid, other.uid)
            && Objects.equals(date, other.date)
            && Objects.equals(summary, other.summary);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uid, date, temperatureC, summary);
    }

    @Override
    public String toString() {
        return "WeatherForecast{uid=" + uid + ", date=" + date
            + ", temperatureC=" + temperatureC + ", summary=" + summary + "}";
    }
}
