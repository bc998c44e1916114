package de.caluga.dataapi.admin;

import de.caluga.dataapi.Db;
import de.caluga.dataapi.driver.commands.CreateKeyspaceCommand;
import de.caluga.dataapi.driver.commands.DropKeyspaceCommand;
import de.caluga.dataapi.driver.commands.FindKeyspacesCommand;
import de.caluga.dataapi.driver.http.DataApiHttpClient;
import de.caluga.dataapi.driver.http.DataApiResponse;
import de.caluga.dataapi.driver.timeouts.TimeoutCategory;
import de.caluga.dataapi.driver.timeouts.TimeoutOverride;

import java.util.ArrayList;
import java.util.List;

/**
 * keyspace administration of one db, using the Data API itself
 */
public class DbAdmin {
    private final Db db;
    private final DataApiHttpClient httpClient;

    public DbAdmin(Db db, DataApiHttpClient httpClient) {
        this.db = db;
        this.httpClient = httpClient;
    }

    public Db getDb() {
        return db;
    }

    public List<String> listKeyspaces() {
        return listKeyspaces(null);
    }

    public List<String> listKeyspaces(TimeoutOverride timeout) {
        DataApiResponse resp = httpClient.executeGlobalCommand(new FindKeyspacesCommand().asMap(), httpClient.timeouts().single(TimeoutCategory.KEYSPACE_ADMIN, timeout));
        List<Object> keyspaces = resp.getStatus().getList("keyspaces");
        List<String> ret = new ArrayList<>();
        if (keyspaces == null) return ret;

        for (Object o : keyspaces) {
            ret.add(String.valueOf(o));
        }

        return ret;
    }

    public void createKeyspace(String name) {
        createKeyspace(name, null);
    }

    public void createKeyspace(String name, TimeoutOverride timeout) {
        CreateKeyspaceCommand cmd = new CreateKeyspaceCommand().setName(name);
        httpClient.executeGlobalCommand(cmd.asMap(), httpClient.timeouts().single(TimeoutCategory.KEYSPACE_ADMIN, timeout));
    }

    public void dropKeyspace(String name) {
        dropKeyspace(name, null);
    }

    public void dropKeyspace(String name, TimeoutOverride timeout) {
        DropKeyspaceCommand cmd = new DropKeyspaceCommand().setName(name);
        httpClient.executeGlobalCommand(cmd.asMap(), httpClient.timeouts().single(TimeoutCategory.KEYSPACE_ADMIN, timeout));
    }

    @Override
    public String toString() {
        return "DbAdmin{" + db + "}";
    }
}
