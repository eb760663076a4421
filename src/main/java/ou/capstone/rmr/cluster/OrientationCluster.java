package ou.capstone.rmr.cluster;

import java.util.List;

import ou.capstone.rmr.model.Orientation;

/**
 * A cluster found by {@link OrientationClusterer}.
 *
 * @param memberIndices positions in the clustered input, ascending
 * @param mean representative orientation (circular mean dip direction, mean dip)
 */
public record OrientationCluster(List<Integer> memberIndices, Orientation mean) {
    public OrientationCluster {
        memberIndices = List.copyOf(memberIndices);
    }

    public int size() {
        return memberIndices.size();
    }
}
